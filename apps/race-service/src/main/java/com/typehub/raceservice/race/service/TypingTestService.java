package com.typehub.raceservice.race.service;

import com.typehub.metrics.KeystrokeRecord;
import com.typehub.metrics.MetricsVerifier.VerificationResult;
import com.typehub.metrics.SessionMetrics;
import com.typehub.metrics.learning.AdaptiveLearningEngine.LearningUpdate;
import com.typehub.raceservice.race.domain.dto.TestSessionRecord;

import java.util.List;

/**
 * 单人测试服务：服务端权威结算与客户端指标复核。
 */
public interface TypingTestService {

    /**
     * 结算一次测试：按键日志回放 → 重算指标 → 落库 → 喂给逐字母练习。
     * @param clientRawWpm   客户端上报值，仅复核用，可为 null
     * @param clientAccuracy 客户端上报值，仅复核用，可为 null
     */
    TestResult finishTest(String userId, String mode, Integer durationSeconds, String targetText,
                          List<KeystrokeRecord> log, Double clientRawWpm, Double clientAccuracy);

    VerificationResult verify(String targetText, List<KeystrokeRecord> log,
                              Double clientRawWpm, Double clientAccuracy);

    List<TestSessionRecord> recentSessions(String userId, int limit);

    /**
     * 结算结果
     */
    record TestResult(TestSessionRecord record,
                      SessionMetrics metrics,
                      VerificationResult verification,
                      LearningUpdate learning) {
    }
}
