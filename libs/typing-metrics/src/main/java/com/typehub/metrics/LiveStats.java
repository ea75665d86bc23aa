package com.typehub.metrics;

/**
 * 比赛中的实时统计（每次输入后计算，推送给对手）。
 *
 * @param rawWpm   总输入字符折算的 WPM
 * @param netWpm   正确字符折算的 WPM
 * @param accuracy 正确字符 / 已输入字符（百分比，两位小数）
 * @param progress 已输入长度 / 目标长度（百分比，向下保留一位小数，最大 100）
 */
public record LiveStats(double rawWpm, double netWpm, double accuracy, double progress) {

    public static final LiveStats ZERO = new LiveStats(0, 0, 100, 0);

    public boolean isFinished() {
        return progress >= 100;
    }
}
