package com.typehub.raceservice.race.domain.channel;

import com.typehub.raceservice.race.domain.model.RaceSnapshot;

import java.util.function.Consumer;

/**
 * 比赛进度通道（发布/订阅）。人机对战不使用。
 * 发送方会收到自己的消息，接收方需自行过滤。
 */
public interface RaceChannel {

    void publish(String channelKey, RaceSnapshot snapshot);

    Subscription subscribe(String channelKey, Consumer<RaceSnapshot> listener);

    /** 订阅句柄 */
    @FunctionalInterface
    interface Subscription {
        void cancel();
    }

    static String keyOf(String roomCode) {
        return "race:" + roomCode;
    }
}
