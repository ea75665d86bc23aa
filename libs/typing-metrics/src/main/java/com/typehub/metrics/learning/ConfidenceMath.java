package com.typehub.metrics.learning;

import com.typehub.metrics.MetricsKernel;

/**
 * 熟练度相关的纯函数。
 * <p>
 * confidence = speedComponent * accuracyComponent * consistencyMultiplier，
 * 新旧样本按 0.7 / 0.3 加权平滑。
 */
public final class ConfidenceMath {

    /** 解锁所需的单字符 WPM */
    public static final double TARGET_WPM = 35;
    /** 低于该 WPM 速度分量为 0 */
    public static final double SPEED_FLOOR_WPM = 12;
    /** 低于该准确率准确分量为 0 */
    public static final double ACCURACY_FLOOR = 90;
    public static final double UNLOCK_ACCURACY = 95;
    public static final double UNLOCK_CONFIDENCE = 0.9;
    public static final int MIN_SAMPLES_FOR_UNLOCK = 20;

    public static final double WEIGHT_NEW = 0.7;
    public static final double WEIGHT_OLD = 0.3;

    private ConfidenceMath() {
    }

    public static double speedComponent(double wpm, double targetWpm) {
        if (wpm <= SPEED_FLOOR_WPM) return 0;
        if (wpm >= targetWpm) return 1;
        return (wpm - SPEED_FLOOR_WPM) / (targetWpm - SPEED_FLOOR_WPM);
    }

    public static double accuracyComponent(double accuracy) {
        if (accuracy <= ACCURACY_FLOOR) return 0;
        return Math.min((accuracy - ACCURACY_FLOOR) / 10, 1.0);
    }

    /** 按键间隔越稳定越接近 1；标准差 200ms 及以上为 0 */
    public static double consistencyMultiplier(double stdDevMs) {
        return Math.max(0, 1 - stdDevMs / 200);
    }

    /** 综合熟练度，保留两位小数 */
    public static double confidence(double wpm, double accuracy, double stdDevMs, double targetWpm) {
        double c = speedComponent(wpm, targetWpm) * accuracyComponent(accuracy) * consistencyMultiplier(stdDevMs);
        return MetricsKernel.sanitize(Math.round(c * 100) / 100d);
    }

    /** 加权平滑：0.7 * 新样本 + 0.3 * 历史值 */
    public static double smooth(double prior, double sample) {
        return WEIGHT_NEW * sample + WEIGHT_OLD * prior;
    }

    public static boolean shouldUnlock(CharacterConfidence stats, double targetWpm) {
        return stats.getWpm() >= targetWpm
                && stats.getAccuracy() >= UNLOCK_ACCURACY
                && stats.getConfidence() >= UNLOCK_CONFIDENCE
                && stats.getOccurrences() >= MIN_SAMPLES_FOR_UNLOCK;
    }
}
