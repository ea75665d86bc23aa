package com.typehub.raceservice.race.domain.bot;

import com.typehub.metrics.KeystrokeRecord;
import com.typehub.metrics.SessionMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BotRunnerTest {

    private static final String TEXT = "the quick brown fox jumps over the lazy dog";
    private static final int RACES = 20;

    @Nested
    @DisplayName("整场模拟")
    class FullRace {

        @ParameterizedTest(name = "{0}")
        @EnumSource(BotLevel.class)
        @DisplayName("20 场平均终速在目标速度的 20% 以内")
        void averageSpeedNearTarget(BotLevel level) {
            double sum = 0;
            for (long seed = 1; seed <= RACES; seed++) {
                List<BotProgress> updates = BotRunner.simulateFullRace(level, TEXT, seed);
                sum += updates.get(updates.size() - 1).wpm();
            }
            double mean = sum / RACES;
            double target = level.profile().targetWpmMean();

            assertThat(mean).isCloseTo(target, within(target * 0.2));
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(BotLevel.class)
        @DisplayName("每次进度都在合法范围内，最后一次为 100%")
        void updatesStayInBounds(BotLevel level) {
            for (long seed = 1; seed <= 5; seed++) {
                List<BotProgress> updates = BotRunner.simulateFullRace(level, TEXT, seed);

                assertThat(updates).isNotEmpty();
                for (BotProgress p : updates) {
                    assertThat(p.progress()).isBetween(0.0, 100.0);
                    assertThat(p.wpm()).isGreaterThanOrEqualTo(0.0).isLessThan(1000.0);
                    assertThat(p.accuracy()).isBetween(0.0, 100.0);
                }
                BotProgress last = updates.get(updates.size() - 1);
                assertThat(last.progress()).isEqualTo(100.0);
                assertThat(last.finished()).isTrue();
            }
        }

        @Test
        @DisplayName("相同种子结果完全一致")
        void sameSeedIsDeterministic() {
            assertThat(BotRunner.simulateFullRace(BotLevel.INTERMEDIATE, TEXT, 42))
                    .isEqualTo(BotRunner.simulateFullRace(BotLevel.INTERMEDIATE, TEXT, 42));
        }

        @Test
        @DisplayName("空文本没有任何进度")
        void emptyText() {
            assertThat(BotRunner.simulateFullRace(BotLevel.PRO, "", 1)).isEmpty();
        }
    }

    @Nested
    @DisplayName("打错与改正")
    class Mistakes {

        @Test
        @DisplayName("打错后退格再补正确字符，最终输入与原文一致")
        void mistakesAreCorrected() {
            int wrongKeys = 0;
            for (long seed = 1; seed <= RACES; seed++) {
                BotRunner bot = runToEnd(BotLevel.BEGINNER, seed);
                assertThat(bot.typedText()).isEqualTo(TEXT);

                List<KeystrokeRecord> log = bot.keystrokes();
                for (int i = 0; i < log.size(); i++) {
                    KeystrokeRecord k = log.get(i);
                    if (!k.isBackspace() && k.typedChar() != k.expectedChar()) {
                        wrongKeys++;
                        assertThat(log.get(i + 1).isBackspace()).isTrue();
                        assertThat(log.get(i + 2).typedChar()).isEqualTo(k.expectedChar());
                    }
                }
            }
            assertThat(wrongKeys).isPositive();
        }

        @Test
        @DisplayName("最后一个字符从不打错")
        void lastCharacterNeverWrong() {
            int last = TEXT.length() - 1;
            for (long seed = 1; seed <= 50; seed++) {
                BotRunner bot = runToEnd(BotLevel.BEGINNER, seed);
                assertThat(bot.keystrokes())
                        .filteredOn(k -> !k.isBackspace() && k.cursorIndex() == last)
                        .singleElement()
                        .satisfies(k -> assertThat(k.typedChar()).isEqualTo(k.expectedChar()));
            }
        }

        @Test
        @DisplayName("按键时间单调不减，会话指标可直接计算")
        void keystrokeTimeline() {
            BotRunner bot = runToEnd(BotLevel.INTERMEDIATE, 7);
            List<KeystrokeRecord> log = bot.keystrokes();
            for (int i = 1; i < log.size(); i++) {
                assertThat(log.get(i).timestampMs()).isGreaterThanOrEqualTo(log.get(i - 1).timestampMs());
            }

            SessionMetrics m = bot.sessionMetrics();
            assertThat(m.netWpm()).isPositive();
            assertThat(m.correctChars()).isEqualTo(TEXT.length());
        }
    }

    @Nested
    @DisplayName("生命周期")
    class Lifecycle {

        @Test
        @DisplayName("开始前 tick 不做任何事")
        void tickBeforeStart() {
            BotRunner bot = BotRunner.create(BotLevel.PRO, TEXT, 1);

            assertThat(bot.tick()).isEqualTo(BotProgress.IDLE);
            assertThat(bot.isStarted()).isFalse();
            assertThat(bot.keystrokes()).isEmpty();
        }

        @Test
        @DisplayName("完成后 tick 返回最后一次进度且不再产生按键")
        void tickAfterFinish() {
            BotRunner bot = runToEnd(BotLevel.PRO, 3);
            int count = bot.keystrokes().size();
            BotProgress last = bot.lastProgress();

            assertThat(bot.tick()).isEqualTo(last);
            assertThat(bot.keystrokes()).hasSize(count);
        }

        @Test
        @DisplayName("抽到的速度落在截断区间内")
        void paceWithinBounds() {
            BotProfile p = BotLevel.INTERMEDIATE.profile();
            for (long seed = 1; seed <= 50; seed++) {
                BotRunner bot = BotRunner.create(BotLevel.INTERMEDIATE, TEXT, seed);
                bot.start(0);
                assertThat(bot.paceWpm()).isBetween(
                        p.targetWpmMean() - 2.5 * p.targetWpmStdDev(),
                        p.targetWpmMean() + 2.5 * p.targetWpmStdDev());
            }
        }

        @Test
        @DisplayName("按键时间戳以开始时刻为基准")
        void timestampsRelativeToStart() {
            BotRunner bot = BotRunner.create(BotLevel.PRO, TEXT, 9);
            bot.start(1_000_000L);
            while (!bot.isFinished()) bot.tick();

            assertThat(bot.startTime()).isEqualTo(1_000_000L);
            assertThat(bot.keystrokes().get(0).timestampMs()).isGreaterThan(1_000_000L);
        }

        @Test
        @DisplayName("tick 周期必须为正")
        void rejectsNonPositiveTick() {
            assertThatThrownBy(() -> new BotRunner(BotLevel.PRO.profile(), TEXT, new java.util.Random(1), 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("等级解析忽略大小写，未知等级报错")
    void parseLevel() {
        assertThat(BotLevel.parse(" pro ")).isEqualTo(BotLevel.PRO);
        assertThat(BotLevel.PRO.participantId()).isEqualTo("BOT_PRO");
        assertThatThrownBy(() -> BotLevel.parse("legend")).isInstanceOf(IllegalArgumentException.class);
    }

    private static BotRunner runToEnd(BotLevel level, long seed) {
        BotRunner bot = BotRunner.create(level, TEXT, seed);
        bot.start(0);
        while (!bot.isFinished()) {
            bot.tick();
        }
        return bot;
    }
}
