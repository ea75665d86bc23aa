package com.typehub.metrics.learning;

/**
 * 单个字母的熟练度档位。
 */
public enum ConfidenceStatus {
    LOCKED,          // 尚未解锁
    WEAK,            // < 0.3
    NEEDS_WORK,      // >= 0.3
    IN_PROGRESS,     // >= 0.6
    NEARLY_UNLOCKED, // >= 0.8
    MASTERED;        // >= 1.0

    public static ConfidenceStatus of(double confidence, boolean unlocked) {
        if (!unlocked) return LOCKED;
        if (confidence >= 1.0) return MASTERED;
        if (confidence >= 0.8) return NEARLY_UNLOCKED;
        if (confidence >= 0.6) return IN_PROGRESS;
        if (confidence >= 0.3) return NEEDS_WORK;
        return WEAK;
    }
}
