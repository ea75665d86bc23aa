package com.typehub.raceservice.infrastructure.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * 全局 Redis 连接、序列化与发布订阅配置
 * -------------------------------------------------------
 * Responsibilities:
 *  - 提供统一的 RedisTemplate 和 StringRedisTemplate Bean；
 *  - 配置序列化策略（Key: String，Value: JSON）；
 *  - 提供发布订阅用的 RedisMessageListenerContainer（比赛进度通道）。
 * -------------------------------------------------------
 * 使用说明：
 *  - RedisTemplate<String, Object>：比赛状态、结果、练习统计等对象存取；
 *  - StringRedisTemplate：房间号索引、pub/sub 的 JSON 文本。
 */
@Configuration
public class RedisConfig {

    /**
     * 通用 RedisTemplate（Key 为 String，Value 自动 JSON 序列化并携带类型信息）
     *
     * @param factory Spring Data Redis 提供的连接工厂（Lettuce）
     * @return RedisTemplate<String, Object> Bean
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, Object> tpl = new RedisTemplate<>();
        tpl.setConnectionFactory(factory);

        StringRedisSerializer keySer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer valSer = new GenericJackson2JsonRedisSerializer();

        tpl.setKeySerializer(keySer);
        tpl.setValueSerializer(valSer);
        tpl.setHashKeySerializer(keySer);
        tpl.setHashValueSerializer(valSer);

        tpl.afterPropertiesSet();
        return tpl;
    }

    /**
     * 纯字符串操作模板
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }

    /**
     * 发布订阅监听容器：比赛进行时按房间动态增删订阅。
     */
    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory factory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(factory);
        return container;
    }
}
