package com.typehub.raceservice.support;

import com.typehub.raceservice.clock.RaceClock;

/**
 * 手动推进的时钟。
 */
public class ManualRaceClock implements RaceClock {

    private long now;

    public ManualRaceClock(long start) {
        this.now = start;
    }

    @Override
    public long nowMs() {
        return now;
    }

    public void set(long ms) {
        this.now = ms;
    }

    public void advance(long ms) {
        this.now += ms;
    }
}
