package com.typehub.raceservice.race.domain.rule;

import com.typehub.raceservice.race.domain.bot.BotLevel;
import com.typehub.raceservice.race.domain.constants.RaceMessages;
import com.typehub.raceservice.race.domain.enums.RaceStatus;
import com.typehub.raceservice.race.domain.model.PlayerState;
import com.typehub.raceservice.race.domain.model.RaceState;
import com.typehub.raceservice.support.ManualRaceClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RaceStateMachineTest {

    private static final String HOST = "host-1";
    private static final String OPP = "opponent-1";
    private static final String TEXT = "the quick brown fox";

    private ManualRaceClock clock;
    private RaceStateMachine machine;

    @BeforeEach
    void setUp() {
        clock = new ManualRaceClock(1_000_000L);
        machine = new RaceStateMachine(clock);
    }

    private RaceState waiting() {
        return machine.createRace("race-1", "ABC123", HOST, TEXT, 60);
    }

    private RaceState withOpponent() {
        return machine.addOpponent(waiting(), OPP, false, null).state();
    }

    private RaceState countdown() {
        return machine.startCountdown(withOpponent(), HOST).state();
    }

    private RaceState active() {
        return machine.startRace(countdown()).state();
    }

    @Nested
    @DisplayName("创建与加入")
    class CreateAndJoin {

        @Test
        @DisplayName("新比赛为 WAITING，version=0，房主进度为 0")
        void createsWaitingRace() {
            RaceState s = waiting();

            assertThat(s.getStatus()).isEqualTo(RaceStatus.WAITING);
            assertThat(s.getVersion()).isZero();
            assertThat(s.getHost().getId()).isEqualTo(HOST);
            assertThat(s.getHost().getProgress()).isZero();
            assertThat(s.getHost().getAccuracy()).isEqualTo(100);
            assertThat(s.getOpponent()).isNull();
        }

        @Test
        @DisplayName("空文本或非正时长直接拒绝")
        void rejectsBadArguments() {
            assertThatThrownBy(() -> machine.createRace("r", "ABC123", HOST, "", 60))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> machine.createRace("r", "ABC123", HOST, TEXT, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("加入对手后 version+1，且不修改入参")
        void addOpponentBumpsVersion() {
            RaceState before = waiting();
            Transition t = machine.addOpponent(before, OPP, false, null);

            assertThat(t.applied()).isTrue();
            assertThat(t.state().getVersion()).isEqualTo(1);
            assertThat(t.state().getOpponent().getId()).isEqualTo(OPP);
            assertThat(before.getVersion()).isZero();
            assertThat(before.getOpponent()).isNull();
        }

        @Test
        @DisplayName("机器人对手带等级并标记为人机对战")
        void botOpponent() {
            RaceState s = machine.addOpponent(waiting(), BotLevel.PRO.participantId(), true, BotLevel.PRO).state();

            assertThat(s.isBotRace()).isTrue();
            assertThat(s.getOpponent().isBot()).isTrue();
            assertThat(s.getOpponent().getBotLevel()).isEqualTo(BotLevel.PRO);
        }

        @Test
        @DisplayName("房间已满、加入自己的比赛、比赛已开始都会被拒绝")
        void joinRejections() {
            assertThatThrownBy(() -> machine.addOpponent(withOpponent(), "third", false, null))
                    .isInstanceOf(RaceStateException.class)
                    .hasMessage(RaceMessages.ROOM_FULL);
            assertThatThrownBy(() -> machine.addOpponent(waiting(), HOST, false, null))
                    .isInstanceOf(RaceStateException.class)
                    .hasMessage(RaceMessages.CANNOT_JOIN_OWN_RACE);
            assertThatThrownBy(() -> machine.addOpponent(active(), "late", false, null))
                    .isInstanceOf(RaceStateException.class)
                    .hasMessage(RaceMessages.RACE_ALREADY_STARTED);
        }
    }

    @Nested
    @DisplayName("倒计时与开赛")
    class CountdownAndStart {

        @Test
        @DisplayName("房主开始倒计时，记录服务端时间")
        void hostStartsCountdown() {
            clock.advance(500);
            Transition t = machine.startCountdown(withOpponent(), HOST);

            assertThat(t.applied()).isTrue();
            assertThat(t.state().getStatus()).isEqualTo(RaceStatus.COUNTDOWN);
            assertThat(t.state().getCountdownStartedAt()).isEqualTo(1_000_500L);
            assertThat(t.state().getVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("没有对手或非房主不能开始倒计时")
        void countdownRejections() {
            assertThatThrownBy(() -> machine.startCountdown(waiting(), HOST))
                    .isInstanceOf(RaceStateException.class)
                    .hasMessage(RaceMessages.NEED_OPPONENT);
            assertThatThrownBy(() -> machine.startCountdown(withOpponent(), OPP))
                    .isInstanceOf(RaceStateException.class)
                    .hasMessage(RaceMessages.HOST_ONLY);
        }

        @Test
        @DisplayName("重复开始倒计时为空操作，version 不变")
        void countdownIsIdempotent() {
            RaceState s = countdown();
            Transition again = machine.startCountdown(s, HOST);

            assertThat(again.applied()).isFalse();
            assertThat(again.state()).isSameAs(s);
            assertThat(again.state().getVersion()).isEqualTo(s.getVersion());
        }

        @Test
        @DisplayName("WAITING 直接开赛非法；COUNTDOWN 开赛后再开为空操作")
        void startRace() {
            assertThatThrownBy(() -> machine.startRace(withOpponent()))
                    .isInstanceOf(RaceStateException.class)
                    .hasMessage(RaceMessages.NOT_IN_COUNTDOWN);

            RaceState s = active();
            assertThat(s.getStatus()).isEqualTo(RaceStatus.ACTIVE);
            assertThat(s.getRaceStartedAt()).isEqualTo(clock.nowMs());
            assertThat(machine.startRace(s).applied()).isFalse();
        }
    }

    @Nested
    @DisplayName("进度更新")
    class Progress {

        @Test
        @DisplayName("非 ACTIVE 或非参赛者更新进度会被拒绝")
        void progressRejections() {
            assertThatThrownBy(() -> machine.updateProgress(countdown(), HOST, 10, 10, 100))
                    .isInstanceOf(RaceStateException.class)
                    .hasMessage(RaceMessages.NOT_ACTIVE);
            assertThatThrownBy(() -> machine.updateProgress(active(), "stranger", 10, 10, 100))
                    .isInstanceOf(RaceStateException.class)
                    .hasMessage(RaceMessages.NOT_A_PARTICIPANT);
        }

        @Test
        @DisplayName("越界与非数值被夹取到合法范围")
        void clampsValues() {
            RaceState s = machine.updateProgress(active(), HOST, 150, 900, -5).state();
            assertThat(s.getHost().getProgress()).isEqualTo(100);
            assertThat(s.getHost().getWpm()).isEqualTo(RaceStateMachine.MAX_WPM);
            assertThat(s.getHost().getAccuracy()).isZero();

            RaceState n = machine.updateProgress(active(), OPP, Double.NaN, Double.POSITIVE_INFINITY, Double.NaN).state();
            assertThat(n.getOpponent().getProgress()).isZero();
            assertThat(n.getOpponent().getWpm()).isZero();
            assertThat(n.getOpponent().getAccuracy()).isZero();
        }

        @Test
        @DisplayName("每次更新 version 恰好 +1，只改目标参赛者")
        void versionIncrementsByOne() {
            RaceState s = active();
            long v = s.getVersion();
            RaceState a = machine.updateProgress(s, HOST, 10, 40, 98).state();
            RaceState b = machine.updateProgress(a, OPP, 20, 50, 97).state();

            assertThat(a.getVersion()).isEqualTo(v + 1);
            assertThat(b.getVersion()).isEqualTo(v + 2);
            assertThat(b.getHost().getProgress()).isEqualTo(10);
            assertThat(b.getOpponent().getProgress()).isEqualTo(20);
        }

        @Test
        @DisplayName("finishedAt 只在首次达到 100 时写入一次")
        void finishedAtSetOnce() {
            RaceState s = active();
            clock.advance(8_000);
            RaceState done = machine.updateProgress(s, HOST, 100, 60, 100).state();
            clock.advance(2_000);
            RaceState again = machine.updateProgress(done, HOST, 100, 58, 99).state();

            assertThat(done.getHost().getFinishedAt()).isEqualTo(1_008_000L);
            assertThat(again.getHost().getFinishedAt()).isEqualTo(1_008_000L);
        }

        @Test
        @DisplayName("远端上报的完成时间为正数时采用，否则用本地时钟")
        void reportedFinishedAt() {
            RaceState s = active();
            RaceState trusted = machine.updateProgress(s, OPP, 100, 60, 100, 999L).state();
            RaceState fallback = machine.updateProgress(s, OPP, 100, 60, 100, 0L).state();

            assertThat(trusted.getOpponent().getFinishedAt()).isEqualTo(999L);
            assertThat(fallback.getOpponent().getFinishedAt()).isEqualTo(clock.nowMs());
        }
    }

    @Nested
    @DisplayName("结束与取消")
    class CompleteAndCancel {

        @Test
        @DisplayName("只有 ACTIVE 可以结束，结束后再结束为空操作")
        void complete() {
            assertThatThrownBy(() -> machine.completeRace(waiting()))
                    .isInstanceOf(RaceStateException.class);
            assertThatThrownBy(() -> machine.completeRace(countdown()))
                    .isInstanceOf(RaceStateException.class);

            RaceState done = machine.completeRace(active()).state();
            assertThat(done.getStatus()).isEqualTo(RaceStatus.COMPLETED);
            assertThat(done.getRaceEndedAt()).isNotNull();

            Transition again = machine.completeRace(done);
            assertThat(again.applied()).isFalse();
            assertThat(again.state().getVersion()).isEqualTo(done.getVersion());
        }

        @Test
        @DisplayName("任何非终态都可以取消，终态取消为空操作")
        void cancel() {
            assertThat(machine.cancelRace(waiting()).state().getStatus()).isEqualTo(RaceStatus.CANCELLED);
            assertThat(machine.cancelRace(countdown()).state().getStatus()).isEqualTo(RaceStatus.CANCELLED);
            RaceState cancelled = machine.cancelRace(active()).state();
            assertThat(cancelled.getStatus()).isEqualTo(RaceStatus.CANCELLED);

            assertThat(machine.cancelRace(cancelled).applied()).isFalse();
            assertThat(machine.completeRace(cancelled).applied()).isFalse();
            assertThat(machine.cancelRace(machine.completeRace(active()).state()).applied()).isFalse();
        }

        @Test
        @DisplayName("迁移表")
        void transitionTable() {
            assertThat(RaceStateMachine.isValidTransition(RaceStatus.WAITING, RaceStatus.COUNTDOWN)).isTrue();
            assertThat(RaceStateMachine.isValidTransition(RaceStatus.COUNTDOWN, RaceStatus.ACTIVE)).isTrue();
            assertThat(RaceStateMachine.isValidTransition(RaceStatus.ACTIVE, RaceStatus.COMPLETED)).isTrue();
            assertThat(RaceStateMachine.isValidTransition(RaceStatus.ACTIVE, RaceStatus.CANCELLED)).isTrue();
            assertThat(RaceStateMachine.isValidTransition(RaceStatus.WAITING, RaceStatus.ACTIVE)).isFalse();
            assertThat(RaceStateMachine.isValidTransition(RaceStatus.COMPLETED, RaceStatus.ACTIVE)).isFalse();
            assertThat(RaceStateMachine.isValidTransition(RaceStatus.CANCELLED, RaceStatus.WAITING)).isFalse();
        }
    }

    @Nested
    @DisplayName("结束时判定胜负")
    class Winner {

        private RaceState finish(double hp, double hw, double ha, double op, double ow, double oa) {
            RaceState s = active();
            s = machine.updateProgress(s, HOST, hp, hw, ha).state();
            s = machine.updateProgress(s, OPP, op, ow, oa).state();
            return machine.completeRace(s).state();
        }

        @Test
        @DisplayName("完成全文的一方胜出，即使速度更低")
        void completionBeatsSpeed() {
            RaceState done = finish(100, 50, 100, 70, 80, 100);
            assertThat(done.getWinnerId()).isEqualTo(HOST);
            assertThat(done.isTie()).isFalse();
        }

        @Test
        @DisplayName("都未完成时速度高者胜出")
        void higherWpmWins() {
            RaceState done = finish(60, 40, 100, 70, 55, 100);
            assertThat(done.getWinnerId()).isEqualTo(OPP);
        }

        @Test
        @DisplayName("速度相同时准确率高者胜出")
        void higherAccuracyWins() {
            RaceState done = finish(50, 60, 97, 50, 60, 95);
            assertThat(done.getWinnerId()).isEqualTo(HOST);
        }

        @Test
        @DisplayName("全部相同为平局")
        void fullTie() {
            RaceState done = finish(50, 60, 98, 50, 60, 98);
            assertThat(done.isTie()).isTrue();
            assertThat(done.getWinnerId()).isNull();
        }

        @Test
        @DisplayName("进度与速度都相同时先完成者胜出")
        void earlierFinishWins() {
            RaceState s = active();
            clock.advance(5_000);
            s = machine.updateProgress(s, HOST, 100, 60, 100).state();
            clock.advance(1_000);
            s = machine.updateProgress(s, OPP, 100, 60, 100).state();

            RaceState done = machine.completeRace(s).state();
            assertThat(done.getWinnerId()).isEqualTo(HOST);
        }
    }

    @Test
    @DisplayName("PlayerState.fresh 默认准确率 100")
    void freshPlayerDefaults() {
        PlayerState p = PlayerState.fresh("x");
        assertThat(p.getAccuracy()).isEqualTo(100);
        assertThat(p.getFinishedAt()).isNull();
    }
}
