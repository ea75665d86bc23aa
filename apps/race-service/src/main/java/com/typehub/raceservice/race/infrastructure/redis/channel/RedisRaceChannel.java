package com.typehub.raceservice.race.infrastructure.redis.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typehub.raceservice.race.domain.channel.RaceChannel;
import com.typehub.raceservice.race.domain.model.RaceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * RedisRaceChannel
 * -------------------------------------------------------
 * 基于 Redis Pub/Sub 的比赛进度通道，频道名 race:{roomCode}，消息体为 RaceSnapshot 的 JSON。
 * -------------------------------------------------------
 * - 发布失败直接抛出，由协调器记录日志；
 * - 无法解析的消息记 WARN 后丢弃，不影响订阅。
 */
@Component
public class RedisRaceChannel implements RaceChannel {

    private static final Logger log = LoggerFactory.getLogger(RedisRaceChannel.class);

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer container;
    private final ObjectMapper objectMapper;

    public RedisRaceChannel(StringRedisTemplate redis,
                            RedisMessageListenerContainer container,
                            ObjectMapper objectMapper) {
        this.redis = redis;
        this.container = container;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(String channelKey, RaceSnapshot snapshot) {
        try {
            redis.convertAndSend(channelKey, objectMapper.writeValueAsString(snapshot));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("快照序列化失败: " + channelKey, e);
        }
    }

    @Override
    public Subscription subscribe(String channelKey, Consumer<RaceSnapshot> listener) {
        ChannelTopic topic = new ChannelTopic(channelKey);
        MessageListener ml = (message, pattern) -> {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            RaceSnapshot snapshot;
            try {
                snapshot = objectMapper.readValue(body, RaceSnapshot.class);
            } catch (JsonProcessingException e) {
                log.warn("丢弃无法解析的比赛快照: channel={}, err={}", channelKey, e.getOriginalMessage());
                return;
            }
            listener.accept(snapshot);
        };
        container.addMessageListener(ml, topic);
        log.debug("订阅比赛通道: {}", channelKey);
        return () -> container.removeMessageListener(ml, topic);
    }
}
