package com.typehub.raceservice.clock;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 基于 ScheduledExecutorService 的定时器实现。
 */
public class ScheduledRaceTimer implements RaceTimer {

    private final ScheduledExecutorService executor;

    public ScheduledRaceTimer(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMs) {
        ScheduledFuture<?> f = executor.schedule(task, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        // 取消调度，但不打断正在运行的任务
        return () -> f.cancel(false);
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, long periodMs) {
        ScheduledFuture<?> f = executor.scheduleAtFixedRate(task, periodMs, periodMs, TimeUnit.MILLISECONDS);
        return () -> f.cancel(false);
    }
}
