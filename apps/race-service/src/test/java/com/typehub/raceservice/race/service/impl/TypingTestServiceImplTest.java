package com.typehub.raceservice.race.service.impl;

import com.typehub.metrics.KeystrokeRecord;
import com.typehub.metrics.learning.AdaptiveLearningEngine;
import com.typehub.raceservice.race.domain.dto.TestSessionRecord;
import com.typehub.raceservice.race.domain.repository.TestSessionRepository;
import com.typehub.raceservice.race.service.TypingTestService.TestResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class TypingTestServiceImplTest {

    private static final String USER = "u-1";

    private TestSessionRepository sessions;
    private AdaptiveLearningEngine learning;
    private TypingTestServiceImpl service;

    @BeforeEach
    void setUp() {
        sessions = mock(TestSessionRepository.class);
        learning = mock(AdaptiveLearningEngine.class);
        service = new TypingTestServiceImpl(sessions, learning, () -> 5_000L);
    }

    /** "cat"，每 200ms 一个字符 */
    private static List<KeystrokeRecord> catLog() {
        return List.of(
                KeystrokeRecord.keydown("s", 'c', 'c', 0, 0),
                KeystrokeRecord.keydown("s", 'a', 'a', 200, 1),
                KeystrokeRecord.keydown("s", 't', 't', 400, 2));
    }

    @Test
    @DisplayName("以按键日志重算为准，客户端上报值只做复核")
    void serverRecomputesMetrics() {
        TestResult r = service.finishTest(USER, "time", 30, "cat", catLog(), 300.0, 100.0);

        assertThat(r.metrics().rawWpm()).isEqualTo(90);
        assertThat(r.metrics().accuracy()).isEqualTo(100);
        assertThat(r.verification().valid()).isFalse();
        assertThat(r.verification().errors()).anyMatch(e -> e.startsWith("rawWpm mismatch"));

        ArgumentCaptor<TestSessionRecord> saved = ArgumentCaptor.forClass(TestSessionRecord.class);
        verify(sessions).save(saved.capture());
        assertThat(saved.getValue().getUserId()).isEqualTo(USER);
        assertThat(saved.getValue().getNetWpm()).isEqualTo(90);
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(5_000L);
        verify(learning).update(eq(USER), argThat(m -> m.keySet().containsAll(List.of('c', 'a', 't'))));
    }

    @Test
    @DisplayName("上报值在容差内时复核通过")
    void matchingClientMetricsAreValid() {
        TestResult r = service.finishTest(USER, "time", 30, "cat", catLog(), 90.0, 100.0);
        assertThat(r.verification().valid()).isTrue();
        assertThat(r.verification().errors()).isEmpty();
    }

    @Test
    @DisplayName("落库失败不影响结算结果")
    void saveFailureIsLogged() {
        doThrow(new IllegalStateException("redis down")).when(sessions).save(any());

        TestResult r = service.finishTest(USER, "time", 30, "cat", catLog(), null, null);

        assertThat(r.record().getRawWpm()).isEqualTo(90);
        assertThat(r.verification().valid()).isTrue();
    }

    @Test
    @DisplayName("没有按键时结果无效且不更新逐字母统计")
    void emptyLog() {
        TestResult r = service.finishTest(USER, "time", 30, "cat", List.of(), null, null);

        assertThat(r.metrics().valid()).isFalse();
        assertThat(r.learning()).isNull();
        verify(learning, never()).update(any(), anyMap());
    }

    @Test
    @DisplayName("缺少用户或目标文本时拒绝")
    void rejectsMissingInput() {
        assertThatThrownBy(() -> service.finishTest(" ", "time", 30, "cat", catLog(), null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.finishTest(USER, "time", 30, "", catLog(), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("查询最近记录时条数至少为 1")
    void recentSessionsLimit() {
        service.recentSessions(USER, 0);
        verify(sessions).recent(USER, 1);
    }
}
