package com.typehub.metrics;

import java.util.ArrayList;
import java.util.List;

/**
 * MetricsKernel
 * -------------------------------------------------------
 * 打字指标的唯一计算来源（测试结算、比赛实时统计、比赛终局统计、机器人评分都走这里）。
 * -------------------------------------------------------
 * Responsibilities:
 *  - 从有序按键日志 + 目标文本 + 最终输入文本，重建完整的 {@link SessionMetrics}；
 *  - 提供 WPM / 准确率 / 稳定性 / 进度等单项公式；
 *  - 对所有对外输出做数值清洗：NaN、无穷大、负数、超大值一律归零。
 * -------------------------------------------------------
 * 约定：
 *  - 一个 "词" 固定为 5 个字符；
 *  - 计时起止均取非退格事件，退格不参与计时与窗口统计；
 *  - 纯函数，无状态，线程安全。
 */
public final class MetricsKernel {

    /** 每个词折算的字符数 */
    public static final double CHARS_PER_WORD = 5.0;
    /** 滑动窗口大小（毫秒） */
    public static final long DEFAULT_WINDOW_MS = 5_000L;
    /** 滑动窗口步长（毫秒） */
    public static final long DEFAULT_STEP_MS = 1_000L;
    /** 超过该值视为异常数据 */
    public static final double MAX_SANE_VALUE = 100_000d;
    /** 使用过退格时准确率的上限 */
    public static final double BACKSPACE_ACCURACY_CAP = 99.99;
    /** 单次会话允许的最大时长（毫秒），超出后不再切分窗口 */
    public static final long MAX_SESSION_MS = 3_600_000L;

    private MetricsKernel() {
    }

    // ==================== 会话级指标 ====================

    /**
     * 从按键日志重建会话指标。
     *
     * @param log        按时间戳有序的按键日志
     * @param targetText 目标文本
     * @param typedText  最终输入文本
     * @return 会话指标；日志中没有任何非退格事件时返回 isValid=false 的零值结果，不抛异常
     */
    public static SessionMetrics computeMetrics(List<KeystrokeRecord> log, String targetText, String typedText) {
        String target = targetText == null ? "" : targetText;
        String typed = typedText == null ? "" : typedText;
        List<KeystrokeRecord> events = log == null ? List.of() : log;

        int backspaceCount = countBackspaces(events);
        List<KeystrokeRecord> keydowns = nonBackspace(events);
        if (keydowns.isEmpty()) {
            return SessionMetrics.empty(target.length(), backspaceCount, "No keystrokes recorded");
        }

        List<String> errors = new ArrayList<>();
        long startMs = keydowns.get(0).timestampMs();
        long endMs = keydowns.get(keydowns.size() - 1).timestampMs();
        long durationMs = endMs - startMs;
        if (durationMs <= 0) {
            errors.add("Invalid duration");
        }
        boolean spanTooLong = durationMs > MAX_SESSION_MS;
        if (spanTooLong) {
            errors.add("Session too long");
        }

        // 逐位比较
        int compareLen = Math.min(typed.length(), target.length());
        int correct = 0;
        int incorrect = 0;
        List<Typo> typos = new ArrayList<>();
        for (int i = 0; i < compareLen; i++) {
            char expected = target.charAt(i);
            char actual = typed.charAt(i);
            if (expected == actual) {
                correct++;
            } else {
                incorrect++;
                typos.add(new Typo(i, expected, actual));
            }
        }
        int missed = Math.max(0, target.length() - typed.length());
        int extra = Math.max(0, typed.length() - target.length());

        List<WpmWindow> windows = spanTooLong
                ? List.of()
                : computeWindowedWpm(events, DEFAULT_WINDOW_MS, DEFAULT_STEP_MS);
        List<Double> windowWpms = new ArrayList<>(windows.size());
        for (WpmWindow w : windows) {
            windowWpms.add(w.wpm());
        }

        double rawWpm = validated("rawWpm", calculateRawWpm(typed.length(), durationMs), errors);
        double netWpm = validated("netWpm", calculateWpm(correct, durationMs), errors);
        double accuracy = validated("accuracy",
                calculateAccuracy(correct, incorrect, missed, extra, backspaceCount > 0), errors);
        double consistency = validated("consistency", calculateConsistency(windowWpms), errors);
        double cps = durationMs > 0 ? round2(typed.length() / (durationMs / 1000d)) : 0;
        cps = validated("charsPerSecond", cps, errors);

        double peak = netWpm;
        double lowest = netWpm;
        boolean anyPositive = false;
        for (double w : windowWpms) {
            if (w <= 0) continue;
            if (!anyPositive) {
                peak = w;
                lowest = w;
                anyPositive = true;
            } else {
                peak = Math.max(peak, w);
                lowest = Math.min(lowest, w);
            }
        }

        return new SessionMetrics(rawWpm, netWpm, accuracy, consistency,
                typed.length(), correct, incorrect, missed, extra, backspaceCount,
                Math.max(0, durationMs), cps, peak, lowest,
                typos, errors.isEmpty(), errors);
    }

    // ==================== 比赛统计 ====================

    /**
     * 比赛中的实时统计：以比赛开始到现在的时长计算 WPM。
     *
     * @param typedText     当前输入
     * @param targetText    比赛文本
     * @param elapsedMs     距比赛开始的毫秒数
     * @param backspaceUsed 是否使用过退格
     */
    public static LiveStats liveStats(String typedText, String targetText, long elapsedMs, boolean backspaceUsed) {
        String typed = typedText == null ? "" : typedText;
        String target = targetText == null ? "" : targetText;

        int correct = countCorrect(typed, target);
        double rawWpm = sanitize(calculateRawWpm(typed.length(), elapsedMs));
        double netWpm = sanitize(calculateWpm(correct, elapsedMs));
        double accuracy = typed.isEmpty() ? 100 : round2(correct * 100d / typed.length());
        if (backspaceUsed && accuracy >= 100) {
            accuracy = BACKSPACE_ACCURACY_CAP;
        }
        accuracy = sanitize(accuracy);
        return new LiveStats(rawWpm, netWpm, accuracy, raceProgress(typed.length(), target.length()));
    }

    /**
     * 比赛终局统计：以首个到最后一个非退格按键的间隔作为用时，准确率为正确字符 / 已输入字符。
     * 没有按键或没有输入时全部为 0。
     */
    public static LiveStats finalRaceStats(List<KeystrokeRecord> log, String typedText, String targetText) {
        String typed = typedText == null ? "" : typedText;
        List<KeystrokeRecord> keydowns = nonBackspace(log == null ? List.of() : log);
        if (keydowns.isEmpty() || typed.isEmpty()) {
            return new LiveStats(0, 0, 0, 0);
        }
        long elapsedMs = keydowns.get(keydowns.size() - 1).timestampMs() - keydowns.get(0).timestampMs();
        return liveStats(typed, targetText, elapsedMs, countBackspaces(log) > 0);
    }

    /**
     * 比赛进度：已输入长度占目标长度的百分比，向下保留一位小数，上限 100。
     * 只有输入长度达到目标长度时才会等于 100。
     */
    public static double raceProgress(int typedLength, int targetLength) {
        if (targetLength <= 0) return 0;
        return Math.min(100, Math.floor(typedLength * 1000d / targetLength) / 10d);
    }

    // ==================== 单项公式 ====================

    /** 净 WPM：(正确字符 / 5) / 分钟，取整；用时 ≤ 0 返回 0 */
    public static double calculateWpm(int correctChars, long elapsedMs) {
        if (elapsedMs <= 0) return 0;
        double minutes = elapsedMs / 60_000d;
        return Math.round((correctChars / CHARS_PER_WORD) / minutes);
    }

    /** 原始 WPM：(全部输入字符 / 5) / 分钟，取整 */
    public static double calculateRawWpm(int totalTypedChars, long elapsedMs) {
        if (elapsedMs <= 0) return 0;
        double minutes = elapsedMs / 60_000d;
        return Math.round((totalTypedChars / CHARS_PER_WORD) / minutes);
    }

    /**
     * 准确率 = correct / (correct + incorrect + missed + extra) * 100，保留两位小数。
     * 分母为 0 时返回 100；用过退格时最高 99.99。
     */
    public static double calculateAccuracy(int correctChars, int incorrectChars, int missedChars,
                                           int extraChars, boolean backspaceUsed) {
        int denominator = correctChars + incorrectChars + missedChars + extraChars;
        if (denominator == 0) return 100;
        // 先舍入再封顶，99.995 以上会被舍入成 100
        double accuracy = round2(correctChars * 100d / denominator);
        if (backspaceUsed && accuracy >= 100) {
            accuracy = BACKSPACE_ACCURACY_CAP;
        }
        return accuracy;
    }

    /**
     * 稳定性 = 100 - 变异系数 * 100（总体标准差），限制在 [0,100]，保留一位小数。
     * 只统计大于 0 的有限窗口值；不足 2 个有效窗口时返回 0。
     */
    public static double calculateConsistency(List<Double> windowWpms) {
        if (windowWpms == null || windowWpms.size() < 2) return 0;
        List<Double> valid = new ArrayList<>(windowWpms.size());
        for (Double w : windowWpms) {
            if (w != null && Double.isFinite(w) && w > 0) valid.add(w);
        }
        if (valid.size() < 2) return 0;

        double sum = 0;
        for (double w : valid) sum += w;
        double mean = sum / valid.size();
        if (mean <= 0) return 0;

        double sq = 0;
        for (double w : valid) sq += (w - mean) * (w - mean);
        double stdDev = Math.sqrt(sq / valid.size());
        double cv = stdDev / mean;

        double consistency = Math.max(0, Math.min(100, 100 - cv * 100));
        return Math.round(consistency * 10) / 10d;
    }

    /**
     * 滑动窗口 WPM：窗口起点从首个非退格事件开始，按 stepMs 递进，
     * 直到起点超过 (最后一个非退格事件 - windowMs)。每个窗口统计 [start, start+windowMs) 内的正确按键。
     * 首尾间隔超过 {@link #MAX_SESSION_MS} 时返回空列表。
     */
    public static List<WpmWindow> computeWindowedWpm(List<KeystrokeRecord> log, long windowMs, long stepMs) {
        if (windowMs <= 0 || stepMs <= 0) {
            throw new IllegalArgumentException("windowMs and stepMs must be positive");
        }
        List<KeystrokeRecord> keydowns = nonBackspace(log == null ? List.of() : log);
        if (keydowns.isEmpty()) return List.of();

        long first = keydowns.get(0).timestampMs();
        long last = keydowns.get(keydowns.size() - 1).timestampMs();
        if (last - first > MAX_SESSION_MS) return List.of();
        List<WpmWindow> windows = new ArrayList<>();
        for (long start = first; start <= last - windowMs; start += stepMs) {
            long end = start + windowMs;
            int correctInWindow = 0;
            for (KeystrokeRecord k : keydowns) {
                if (k.timestampMs() >= start && k.timestampMs() < end && k.isCorrect()) {
                    correctInWindow++;
                }
            }
            windows.add(new WpmWindow(start, end, calculateWpm(correctInWindow, windowMs), correctInWindow));
        }
        return windows;
    }

    public static List<WpmWindow> computeWindowedWpm(List<KeystrokeRecord> log) {
        return computeWindowedWpm(log, DEFAULT_WINDOW_MS, DEFAULT_STEP_MS);
    }

    /** 数值清洗：NaN / 无穷大 / 负数 / 超过 100000 一律返回 0 */
    public static double sanitize(double value) {
        return sanitize(value, false);
    }

    public static double sanitize(double value, boolean allowNegative) {
        if (!Double.isFinite(value)) return 0;
        if (!allowNegative && value < 0) return 0;
        if (value > MAX_SANE_VALUE) return 0;
        return value;
    }

    /** 进度（按正确字符计）：百分比，一位小数，限制在 [0,100] */
    public static double calculateProgress(int correctChars, int expectedTextLength) {
        if (expectedTextLength <= 0) return 0;
        double progress = correctChars * 100d / expectedTextLength;
        return Math.min(100, Math.max(0, Math.round(progress * 10) / 10d));
    }

    /** 按日志回放出最终输入文本：退格删除末尾一个字符 */
    public static String reconstructTypedText(List<KeystrokeRecord> log) {
        StringBuilder sb = new StringBuilder();
        if (log == null) return "";
        for (KeystrokeRecord k : log) {
            if (k.isBackspace()) {
                if (sb.length() > 0) sb.setLength(sb.length() - 1);
            } else if (k.typedChar() != KeystrokeRecord.NO_CHAR) {
                sb.append(k.typedChar());
            }
        }
        return sb.toString();
    }

    // ==================== 内部工具 ====================

    static double round2(double v) {
        return Math.round(v * 100) / 100d;
    }

    private static int countCorrect(String typed, String target) {
        int len = Math.min(typed.length(), target.length());
        int correct = 0;
        for (int i = 0; i < len; i++) {
            if (typed.charAt(i) == target.charAt(i)) correct++;
        }
        return correct;
    }

    private static int countBackspaces(List<KeystrokeRecord> log) {
        int n = 0;
        for (KeystrokeRecord k : log) {
            if (k.isBackspace()) n++;
        }
        return n;
    }

    private static List<KeystrokeRecord> nonBackspace(List<KeystrokeRecord> log) {
        List<KeystrokeRecord> out = new ArrayList<>(log.size());
        for (KeystrokeRecord k : log) {
            if (!k.isBackspace()) out.add(k);
        }
        return out;
    }

    private static double validated(String name, double value, List<String> errors) {
        if (!Double.isFinite(value)) {
            errors.add("Invalid " + name + ": " + value);
        }
        return sanitize(value);
    }
}
