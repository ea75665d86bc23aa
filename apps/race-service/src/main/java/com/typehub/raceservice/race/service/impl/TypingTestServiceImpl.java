package com.typehub.raceservice.race.service.impl;

import com.typehub.metrics.KeystrokeRecord;
import com.typehub.metrics.MetricsKernel;
import com.typehub.metrics.MetricsVerifier;
import com.typehub.metrics.MetricsVerifier.VerificationResult;
import com.typehub.metrics.SessionMetrics;
import com.typehub.metrics.learning.AdaptiveLearningEngine;
import com.typehub.metrics.learning.AdaptiveLearningEngine.LearningUpdate;
import com.typehub.metrics.learning.CharacterSample;
import com.typehub.metrics.learning.PerCharacterAnalyzer;
import com.typehub.raceservice.clock.RaceClock;
import com.typehub.raceservice.race.domain.dto.TestSessionRecord;
import com.typehub.raceservice.race.domain.repository.TestSessionRepository;
import com.typehub.raceservice.race.service.TypingTestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * TypingTestServiceImpl
 * -------------------------------------------------------
 * 单人测试的权威结算：客户端算出的 wpm / accuracy 一律不采信，
 * 只根据按键日志在服务端重算并保存；上报值只做复核并记录差异。
 * -------------------------------------------------------
 * 落库或练习统计失败只记日志，不影响返回结算结果。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TypingTestServiceImpl implements TypingTestService {

    private final TestSessionRepository sessionRepository;
    private final AdaptiveLearningEngine learningEngine;
    private final RaceClock clock;

    @Override
    public TestResult finishTest(String userId, String mode, Integer durationSeconds, String targetText,
                                 List<KeystrokeRecord> keystrokeLog, Double clientRawWpm, Double clientAccuracy) {
        if (StringUtils.isBlank(userId)) throw new IllegalArgumentException("userId 不能为空");
        if (StringUtils.isEmpty(targetText)) throw new IllegalArgumentException("targetText 不能为空");
        List<KeystrokeRecord> keystrokes = keystrokeLog == null ? List.of() : keystrokeLog;

        String typed = MetricsKernel.reconstructTypedText(keystrokes);
        SessionMetrics metrics = MetricsKernel.computeMetrics(keystrokes, targetText, typed);
        VerificationResult verification = MetricsVerifier.verify(clientRawWpm, clientAccuracy, keystrokes, targetText);
        if (!verification.valid()) {
            log.warn("客户端指标与服务端不一致: userId={}, errors={}", userId, verification.errors());
        }

        TestSessionRecord record = TestSessionRecord.builder()
                .sessionId(UUID.randomUUID().toString())
                .userId(userId)
                .mode(mode)
                .durationSeconds(durationSeconds != null ? durationSeconds : (int) Math.round(metrics.durationMs() / 1000d))
                .rawWpm(metrics.rawWpm())
                .netWpm(metrics.netWpm())
                .accuracy(metrics.accuracy())
                .consistency(metrics.consistency())
                .totalCharacters(metrics.totalTypedChars())
                .correctCharacters(metrics.correctChars())
                .errorCount(metrics.incorrectChars())
                .valid(metrics.valid())
                .createdAt(clock.nowMs())
                .build();
        try {
            sessionRepository.save(record);
        } catch (RuntimeException e) {
            log.warn("测试记录落库失败: userId={}, err={}", userId, e.getMessage());
        }

        LearningUpdate learning = null;
        Map<Character, CharacterSample> samples = PerCharacterAnalyzer.analyze(keystrokes);
        if (!samples.isEmpty()) {
            try {
                learning = learningEngine.update(userId, samples);
            } catch (RuntimeException e) {
                log.warn("逐字母统计更新失败: userId={}, err={}", userId, e.getMessage());
            }
        }
        log.info("测试结算: userId={}, mode={}, netWpm={}, accuracy={}", userId, mode,
                metrics.netWpm(), metrics.accuracy());
        return new TestResult(record, metrics, verification, learning);
    }

    @Override
    public VerificationResult verify(String targetText, List<KeystrokeRecord> log,
                                     Double clientRawWpm, Double clientAccuracy) {
        return MetricsVerifier.verify(clientRawWpm, clientAccuracy, log == null ? List.of() : log, targetText);
    }

    @Override
    public List<TestSessionRecord> recentSessions(String userId, int limit) {
        return sessionRepository.recent(userId, Math.max(1, limit));
    }
}
