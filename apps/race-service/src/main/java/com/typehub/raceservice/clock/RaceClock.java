package com.typehub.raceservice.clock;

/**
 * RaceClock
 * ---------------------------------------
 * 服务端权威时钟。比赛的开赛时间、按键时间戳、到时判定全部以它为准，
 * 客户端上报的时间只作参考。
 */
@FunctionalInterface
public interface RaceClock {

    /**
     * @return 当前毫秒时间戳
     */
    long nowMs();
}
