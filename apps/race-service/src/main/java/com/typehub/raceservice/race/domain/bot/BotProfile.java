package com.typehub.raceservice.race.domain.bot;

/**
 * 机器人打字画像。
 *
 * @param targetWpmMean        目标速度均值
 * @param targetWpmStdDev      每场比赛速度的标准差
 * @param mistakeProbability   单次按键打错的概率
 * @param correctionDelayMinMs 发现错误到按退格的最短延迟
 * @param correctionDelayMaxMs 发现错误到按退格的最长延迟
 * @param sigma                按键间隔对数正态分布的形状参数
 */
public record BotProfile(double targetWpmMean,
                         double targetWpmStdDev,
                         double mistakeProbability,
                         long correctionDelayMinMs,
                         long correctionDelayMaxMs,
                         double sigma) {

    public static final double DEFAULT_SIGMA = 0.35;

    public BotProfile {
        if (targetWpmMean <= 0) throw new IllegalArgumentException("targetWpmMean must be positive");
        if (targetWpmStdDev < 0) throw new IllegalArgumentException("targetWpmStdDev must not be negative");
        if (mistakeProbability < 0 || mistakeProbability >= 1) {
            throw new IllegalArgumentException("mistakeProbability must be in [0,1)");
        }
        if (correctionDelayMinMs < 0 || correctionDelayMaxMs < correctionDelayMinMs) {
            throw new IllegalArgumentException("invalid correction delay range");
        }
    }

    /** 均值速度对应的平均按键间隔：60000 / (wpm * 5) */
    public double interKeystrokeIntervalMeanMs() {
        return 12000.0 / targetWpmMean;
    }

    public double meanCorrectionDelayMs() {
        return (correctionDelayMinMs + correctionDelayMaxMs) / 2.0;
    }
}
