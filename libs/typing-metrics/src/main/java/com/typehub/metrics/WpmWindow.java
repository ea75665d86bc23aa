package com.typehub.metrics;

/**
 * 滑动窗口内的 WPM 采样。
 *
 * @param startMs      窗口起点（含）
 * @param endMs        窗口终点（不含）
 * @param wpm          窗口内正确字符折算的 WPM
 * @param correctChars 窗口内正确字符数
 */
public record WpmWindow(long startMs, long endMs, double wpm, int correctChars) {
}
