package com.typehub.metrics.learning;

/**
 * 一次练习中某个字母的统计样本。
 *
 * @param character   小写字母
 * @param wpm         (60000 / avgTimeMs) / 5
 * @param accuracy    正确次数 / 总次数 * 100
 * @param occurrences 出现次数
 * @param avgTimeMs   与上一个正确按键的平均间隔，无有效间隔时为 500
 * @param stdDev      间隔的总体标准差
 */
public record CharacterSample(char character, double wpm, double accuracy, int occurrences,
                              double avgTimeMs, double stdDev) {
}
