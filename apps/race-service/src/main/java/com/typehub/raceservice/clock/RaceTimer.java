package com.typehub.raceservice.clock;

/**
 * RaceTimer
 * ---------------------------------------
 * 比赛内的一次性 / 周期性定时器抽象（节流补发、比赛时长到期、机器人 tick）。
 * 生产环境由线程池实现，测试里用手动推进的实现替换。
 */
public interface RaceTimer {

    /**
     * 延迟执行一次。
     * @param task    任务
     * @param delayMs 延迟毫秒，≤0 表示尽快执行
     * @return 可取消句柄
     */
    Cancellable schedule(Runnable task, long delayMs);

    /**
     * 按固定周期执行，首次在一个周期之后。
     * @param task     任务
     * @param periodMs 周期毫秒
     * @return 可取消句柄
     */
    Cancellable scheduleAtFixedRate(Runnable task, long periodMs);

    /**
     * 定时任务句柄。
     */
    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
