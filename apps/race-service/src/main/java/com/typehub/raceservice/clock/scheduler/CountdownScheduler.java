package com.typehub.raceservice.clock.scheduler;

/**
 * CountdownScheduler
 * ---------------------------------------
 * 通用的“倒计时调度器”接口，不依赖比赛规则。
 *
 * 设计目标：
 *  - 提供统一的倒计时能力（启动/停止/全量恢复）；
 *  - 暴露“每秒 tick 回调”和“到期 timeout 回调”；
 *  - 消息广播、状态迁移由上层协调器负责。
 */
public interface CountdownScheduler {

    /**
     * 每秒触发一次，报告 key、所属对象、绝对截止时间、剩余秒数。
     */
    interface TickListener {
        /**
         * @param key              业务键（如 "race:{roomCode}"）
         * @param owner            被计时的对象（比赛ID）
         * @param deadlineEpochMs  绝对截止时间（毫秒）
         * @param remainingSeconds 剩余秒数（服务端计算）
         */
        void onTick(String key, String owner, long deadlineEpochMs, long remainingSeconds);
    }

    /**
     * 到期时回调一次，由上层做权威处理。
     */
    interface TimeoutHandler {
        /**
         * @param key     业务键
         * @param owner   被计时的对象
         * @param version 启动倒计时时的状态版本（上层用于幂等保护）
         */
        void onTimeout(String key, String owner, String version);
    }

    void setTickListener(TickListener listener);

    /**
     * 启动或恢复指定 key 的倒计时，状态会持久化以便重启恢复。
     * @param key             业务键
     * @param owner           被计时的对象
     * @param deadlineEpochMs 绝对截止时间（毫秒）
     * @param version         状态版本
     * @param onTimeout       到期回调
     */
    void startOrResume(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout);

    /**
     * 停止指定 key 的倒计时并清理持久化状态。
     */
    void stop(String key);

    /**
     * 从持久化介质恢复所有仍未到期的倒计时；已到期的直接回调一次超时。
     * @return 恢复的任务数
     */
    int restoreAllActive(TimeoutHandler onTimeout);
}
