package com.typehub.metrics.learning;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class AdaptiveLearningEngineTest {

    private static final String USER = "u-1";

    private InMemoryCharacterStatsRepository repository;
    private AdaptiveLearningEngine engine;

    @BeforeEach
    void setUp() {
        repository = new InMemoryCharacterStatsRepository();
        engine = new AdaptiveLearningEngine(repository);
    }

    @Test
    @DisplayName("新用户只解锁 8 个初始字母，下一个是 h")
    void newUserStartsWithEightLetters() {
        assertThat(engine.unlockedLetters(USER)).containsExactly('a', 'e', 'i', 'n', 'o', 'r', 's', 't');
        assertThat(engine.lockedLetters(USER)).hasSize(18).doesNotContain('e');
        assertThat(engine.nextToUnlock(USER)).isEqualTo('h');
    }

    @Test
    @DisplayName("达到速度、准确率、熟练度与样本数要求后解锁")
    void unlocksWhenAllThresholdsMet() {
        AdaptiveLearningEngine.LearningUpdate r = engine.update(USER,
                Map.of('h', new CharacterSample('h', 60, 100, 25, 200, 0)));

        assertThat(r.newlyUnlocked()).containsExactly('h');
        assertThat(r.nextToUnlock()).isEqualTo('d');
        assertThat(r.updated().get(0).getStatus()).isEqualTo(ConfidenceStatus.MASTERED);
        assertThat(engine.unlockedLetters(USER)).contains('h');
    }

    @Test
    @DisplayName("样本不足 20 个时不解锁")
    void needsEnoughSamples() {
        AdaptiveLearningEngine.LearningUpdate r = engine.update(USER,
                Map.of('h', new CharacterSample('h', 60, 100, 10, 200, 0)));

        assertThat(r.newlyUnlocked()).isEmpty();
        assertThat(r.updated().get(0).getStatus()).isEqualTo(ConfidenceStatus.LOCKED);
    }

    @Test
    @DisplayName("第二次样本按 0.7/0.3 平滑，样本数累加")
    void smoothsAcrossSessions() {
        engine.update(USER, Map.of('e', new CharacterSample('e', 20, 90, 5, 600, 50)));
        engine.update(USER, Map.of('e', new CharacterSample('e', 30, 100, 7, 400, 10)));

        CharacterConfidence e = repository.findAll(USER).get('e');
        assertThat(e.getWpm()).isEqualTo(27.0);
        assertThat(e.getAccuracy()).isEqualTo(97.0);
        assertThat(e.getOccurrences()).isEqualTo(12);
        assertThat(e.getAvgTimeMs()).isEqualTo(460);
        assertThat(e.isUnlocked()).isTrue();
    }

    @Test
    @DisplayName("薄弱字母按熟练度升序，有数据的排前面")
    void weakLettersOrdering() {
        engine.update(USER, Map.of(
                'e', new CharacterSample('e', 30, 96, 5, 400, 0),
                't', new CharacterSample('t', 15, 92, 5, 800, 0)));

        assertThat(engine.weakLetters(USER, 3)).containsExactly('t', 'e', 'a');
    }

    @Test
    @DisplayName("课文只包含已解锁字母")
    void lessonUsesUnlockedLettersOnly() {
        AdaptiveLearningEngine.Lesson lesson = engine.lesson(USER, 30, new Random(7));

        assertThat(lesson.text().split(" ")).hasSize(30);
        for (char c : lesson.text().replace(" ", "").toCharArray()) {
            assertThat(lesson.availableLetters()).contains(c);
        }
        assertThat(lesson.focusLetters()).isNotEmpty();
    }

    @Test
    void resetClearsProgress() {
        engine.update(USER, Map.of('h', new CharacterSample('h', 60, 100, 25, 200, 0)));

        engine.reset(USER);

        assertThat(engine.unlockedLetters(USER)).doesNotContain('h');
    }
}
