package com.typehub.raceservice.support;

import com.typehub.raceservice.clock.RaceTimer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 手动推进的定时器：advance 时按到期先后执行任务，并把时钟拨到任务到期时刻。
 */
public class ManualRaceTimer implements RaceTimer {

    private static final class Task {
        long dueAt;
        final long period;
        final Runnable runnable;
        final long seq;
        boolean cancelled;

        Task(long dueAt, long period, Runnable runnable, long seq) {
            this.dueAt = dueAt;
            this.period = period;
            this.runnable = runnable;
            this.seq = seq;
        }
    }

    private final ManualRaceClock clock;
    private final List<Task> tasks = new ArrayList<>();
    private long seq;

    public ManualRaceTimer(ManualRaceClock clock) {
        this.clock = clock;
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMs) {
        Task t = new Task(clock.nowMs() + Math.max(0, delayMs), 0, task, seq++);
        tasks.add(t);
        return () -> t.cancelled = true;
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, long periodMs) {
        Task t = new Task(clock.nowMs() + periodMs, periodMs, task, seq++);
        tasks.add(t);
        return () -> t.cancelled = true;
    }

    public void advance(long ms) {
        long target = clock.nowMs() + ms;
        while (true) {
            Task next = tasks.stream()
                    .filter(t -> !t.cancelled && t.dueAt <= target)
                    .min(Comparator.comparingLong((Task t) -> t.dueAt).thenComparingLong(t -> t.seq))
                    .orElse(null);
            if (next == null) break;
            clock.set(Math.max(clock.nowMs(), next.dueAt));
            if (next.period > 0) {
                next.dueAt += next.period;
            } else {
                next.cancelled = true;
            }
            next.runnable.run();
        }
        tasks.removeIf(t -> t.cancelled);
        clock.set(target);
    }

    /** 尚未取消的任务数 */
    public long activeCount() {
        return tasks.stream().filter(t -> !t.cancelled).count();
    }
}
