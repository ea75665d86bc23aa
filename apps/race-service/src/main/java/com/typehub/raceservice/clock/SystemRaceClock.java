package com.typehub.raceservice.clock;

import org.springframework.stereotype.Component;

/**
 * 默认时钟：直接读取系统时间。
 */
@Component
public class SystemRaceClock implements RaceClock {

    @Override
    public long nowMs() {
        return System.currentTimeMillis();
    }
}
