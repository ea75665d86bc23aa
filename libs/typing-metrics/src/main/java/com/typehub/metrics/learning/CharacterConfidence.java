package com.typehub.metrics.learning;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个字母的累计熟练度（持久化对象，按用户存储）。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CharacterConfidence {
    /** 小写字母 */
    private char character;
    /** 熟练度 0.0 ~ 1.0 */
    private double confidence;
    /** 单字符 WPM（由平均按键间隔换算） */
    private double wpm;
    /** 准确率（百分比） */
    private double accuracy;
    /** 累计样本数 */
    private int occurrences;
    /** 平均按键间隔（毫秒） */
    private double avgTimeMs;
    /** 按键间隔标准差（毫秒） */
    private double stdDev;
    private boolean unlocked;
    private ConfidenceStatus status;
}
