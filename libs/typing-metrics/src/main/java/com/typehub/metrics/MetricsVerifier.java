package com.typehub.metrics;

import java.util.ArrayList;
import java.util.List;

/**
 * 客户端上报指标的服务端复核：用按键日志回放出输入文本，重新计算后与上报值比对。
 */
public final class MetricsVerifier {

    /** 允许误差：准确率为绝对值（百分点），WPM 为相对百分比 */
    public static final double TOLERANCE = 0.5;
    /** WPM 的最小绝对误差（小于该值一律放行） */
    public static final double MIN_WPM_DIFF = 2;

    private MetricsVerifier() {
    }

    /**
     * 复核客户端指标。
     *
     * @param clientRawWpm   客户端上报的原始 WPM，可为 null（不复核）
     * @param clientAccuracy 客户端上报的准确率，可为 null（不复核）
     * @param log            按键日志
     * @param targetText     目标文本
     */
    public static VerificationResult verify(Double clientRawWpm, Double clientAccuracy,
                                            List<KeystrokeRecord> log, String targetText) {
        String typed = MetricsKernel.reconstructTypedText(log);
        SessionMetrics computed = MetricsKernel.computeMetrics(log, targetText, typed);
        List<String> errors = new ArrayList<>();

        if (clientRawWpm != null) {
            double diff = Math.abs(clientRawWpm - computed.rawWpm());
            if (diff > computed.rawWpm() * (TOLERANCE / 100) && diff > MIN_WPM_DIFF) {
                errors.add("rawWpm mismatch: client=" + clientRawWpm + ", server=" + computed.rawWpm());
            }
        }
        if (clientAccuracy != null) {
            double diff = Math.abs(clientAccuracy - computed.accuracy());
            if (diff > TOLERANCE) {
                errors.add("accuracy mismatch: client=" + clientAccuracy + ", server=" + computed.accuracy());
            }
        }
        return new VerificationResult(errors.isEmpty(), errors, computed);
    }

    /** 复核结果 */
    public record VerificationResult(boolean valid, List<String> errors, SessionMetrics computedMetrics) {
        public VerificationResult {
            errors = List.copyOf(errors);
        }
    }
}
