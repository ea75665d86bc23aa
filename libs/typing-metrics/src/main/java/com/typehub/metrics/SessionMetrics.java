package com.typehub.metrics;

import java.util.List;

/**
 * 一次打字会话的完整指标，由 {@link MetricsKernel#computeMetrics} 从按键日志重建。
 * 同样的输入总是得到相同的结果。
 */
public record SessionMetrics(double rawWpm,
                             double netWpm,
                             double accuracy,
                             double consistency,
                             int totalTypedChars,
                             int correctChars,
                             int incorrectChars,
                             int missedChars,
                             int extraChars,
                             int backspaceCount,
                             long durationMs,
                             double charsPerSecond,
                             double peakWpm,
                             double lowestWpm,
                             List<Typo> typos,
                             boolean valid,
                             List<String> validationErrors) {

    public SessionMetrics {
        typos = typos == null ? List.of() : List.copyOf(typos);
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
    }

    /**
     * 没有任何有效按键时的结果：全部为 0，准确率 100，未输入的目标字符全部计为 missed。
     */
    public static SessionMetrics empty(int targetLength, int backspaceCount, String reason) {
        return new SessionMetrics(0, 0, 100, 0,
                0, 0, 0, Math.max(0, targetLength), 0, backspaceCount,
                0L, 0, 0, 0,
                List.of(), false, List.of(reason));
    }
}
