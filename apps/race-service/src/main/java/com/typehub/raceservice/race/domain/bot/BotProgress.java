package com.typehub.raceservice.race.domain.bot;

/**
 * 机器人每个 tick 后的进度快照。
 *
 * @param progress  进度 0~100
 * @param wpm       净速
 * @param accuracy  准确率
 * @param elapsedMs 距开始的虚拟时间
 * @param finished  是否已打完
 */
public record BotProgress(double progress, double wpm, double accuracy, long elapsedMs, boolean finished) {

    public static final BotProgress IDLE = new BotProgress(0, 0, 100, 0, false);
}
