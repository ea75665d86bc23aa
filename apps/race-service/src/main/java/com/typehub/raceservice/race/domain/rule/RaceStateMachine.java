package com.typehub.raceservice.race.domain.rule;

import com.typehub.metrics.MetricsKernel;
import com.typehub.raceservice.clock.RaceClock;
import com.typehub.raceservice.race.domain.bot.BotLevel;
import com.typehub.raceservice.race.domain.constants.RaceMessages;
import com.typehub.raceservice.race.domain.enums.RaceStatus;
import com.typehub.raceservice.race.domain.model.PlayerState;
import com.typehub.raceservice.race.domain.model.RaceState;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * RaceStateMachine
 * -------------------------------------------------------
 * 比赛生命周期的唯一规则来源（纯逻辑，无 IO）。
 * -------------------------------------------------------
 * Responsibilities:
 *  - 校验并执行状态迁移，返回 {@link Transition}；
 *  - 重复请求（如再次开始倒计时、已结束后再结束）返回空操作，不抛异常；
 *  - 真正非法的请求（WAITING 直接开赛、非房主开倒计时）抛 {@link RaceStateException}；
 *  - 进度写入前做 sanitize + 夹取，保证状态里永远是合法数值。
 * -------------------------------------------------------
 * 每次成功迁移 version 恰好 +1；入参 state 不会被修改。
 */
public class RaceStateMachine {

    public static final double MAX_WPM = 500;

    private static final Map<RaceStatus, Set<RaceStatus>> ALLOWED = Map.of(
            RaceStatus.WAITING, EnumSet.of(RaceStatus.COUNTDOWN, RaceStatus.CANCELLED),
            RaceStatus.COUNTDOWN, EnumSet.of(RaceStatus.ACTIVE, RaceStatus.CANCELLED),
            RaceStatus.ACTIVE, EnumSet.of(RaceStatus.COMPLETED, RaceStatus.CANCELLED),
            RaceStatus.COMPLETED, EnumSet.noneOf(RaceStatus.class),
            RaceStatus.CANCELLED, EnumSet.noneOf(RaceStatus.class));

    private final RaceClock clock;

    public RaceStateMachine(RaceClock clock) {
        this.clock = clock;
    }

    /**
     * 新建比赛，version=0，状态 WAITING。
     */
    public RaceState createRace(String id, String roomCode, String hostId, String expectedText, int durationSeconds) {
        if (expectedText == null || expectedText.isEmpty()) {
            throw new IllegalArgumentException(RaceMessages.TEXT_REQUIRED);
        }
        if (durationSeconds <= 0) {
            throw new IllegalArgumentException(RaceMessages.DURATION_INVALID);
        }
        return RaceState.builder()
                .id(id)
                .roomCode(roomCode)
                .status(RaceStatus.WAITING)
                .hostId(hostId)
                .host(PlayerState.fresh(hostId))
                .expectedText(expectedText)
                .durationSeconds(durationSeconds)
                .version(0)
                .build();
    }

    /**
     * 加入对手：只允许 WAITING 且尚无对手。
     */
    public Transition addOpponent(RaceState state, String opponentId, boolean isBot, BotLevel botLevel) {
        if (state.getStatus() != RaceStatus.WAITING) {
            throw new RaceStateException(RaceMessages.RACE_ALREADY_STARTED);
        }
        if (state.hasOpponent()) {
            throw new RaceStateException(RaceMessages.ROOM_FULL);
        }
        if (state.getHostId().equals(opponentId)) {
            throw new RaceStateException(RaceMessages.CANNOT_JOIN_OWN_RACE);
        }
        PlayerState opponent = isBot ? PlayerState.bot(opponentId, botLevel) : PlayerState.fresh(opponentId);
        return Transition.applied(bump(state.toBuilder()
                .opponent(opponent)
                .botRace(isBot)));
    }

    /**
     * 房主开始倒计时。非 WAITING 视为重复请求。
     */
    public Transition startCountdown(RaceState state, String requesterId) {
        if (state.getStatus() != RaceStatus.WAITING) {
            return Transition.noop(state);
        }
        if (!state.hasOpponent()) {
            throw new RaceStateException(RaceMessages.NEED_OPPONENT);
        }
        if (!state.getHostId().equals(requesterId)) {
            throw new RaceStateException(RaceMessages.HOST_ONLY);
        }
        return Transition.applied(bump(state.toBuilder()
                .status(RaceStatus.COUNTDOWN)
                .countdownStartedAt(clock.nowMs())));
    }

    /**
     * 倒计时结束开赛。
     */
    public Transition startRace(RaceState state) {
        RaceStatus s = state.getStatus();
        if (s == RaceStatus.ACTIVE || s.isTerminal()) {
            return Transition.noop(state);
        }
        if (s != RaceStatus.COUNTDOWN) {
            throw new RaceStateException(RaceMessages.NOT_IN_COUNTDOWN);
        }
        return Transition.applied(bump(state.toBuilder()
                .status(RaceStatus.ACTIVE)
                .raceStartedAt(clock.nowMs())));
    }

    public Transition updateProgress(RaceState state, String participantId,
                                     double progress, double wpm, double accuracy) {
        return updateProgress(state, participantId, progress, wpm, accuracy, null);
    }

    /**
     * 写入参赛者进度。
     * @param reportedFinishedAt 远端快照携带的完成时间；为 null 时取本地时钟
     */
    public Transition updateProgress(RaceState state, String participantId,
                                     double progress, double wpm, double accuracy,
                                     Long reportedFinishedAt) {
        if (state.getStatus() != RaceStatus.ACTIVE) {
            throw new RaceStateException(RaceMessages.NOT_ACTIVE);
        }
        PlayerState current = state.participant(participantId);
        if (current == null) {
            throw new RaceStateException(RaceMessages.NOT_A_PARTICIPANT);
        }

        double p = clamp(MetricsKernel.sanitize(progress), 100);
        PlayerState.PlayerStateBuilder next = current.toBuilder()
                .progress(p)
                .wpm(clamp(MetricsKernel.sanitize(wpm), MAX_WPM))
                .accuracy(clamp(MetricsKernel.sanitize(accuracy), 100));
        if (current.getFinishedAt() == null && p >= 100) {
            boolean trusted = reportedFinishedAt != null && reportedFinishedAt > 0;
            next.finishedAt(trusted ? reportedFinishedAt : clock.nowMs());
        }

        RaceState.RaceStateBuilder b = state.toBuilder();
        if (current == state.getHost()) {
            b.host(next.build());
        } else {
            b.opponent(next.build());
        }
        return Transition.applied(bump(b));
    }

    /**
     * 结束比赛并判定胜负。
     */
    public Transition completeRace(RaceState state) {
        RaceStatus s = state.getStatus();
        if (s.isTerminal()) {
            return Transition.noop(state);
        }
        if (s != RaceStatus.ACTIVE) {
            throw new RaceStateException(RaceMessages.NOT_ACTIVE);
        }
        RaceOutcome outcome = WinnerJudge.judge(state.getHost(), state.getOpponent());
        return Transition.applied(bump(state.toBuilder()
                .status(RaceStatus.COMPLETED)
                .raceEndedAt(clock.nowMs())
                .winnerId(outcome.winnerId())
                .tie(outcome.tie())));
    }

    /**
     * 取消比赛：任何非终态都可取消。
     */
    public Transition cancelRace(RaceState state) {
        if (state.getStatus().isTerminal()) {
            return Transition.noop(state);
        }
        return Transition.applied(bump(state.toBuilder()
                .status(RaceStatus.CANCELLED)
                .raceEndedAt(clock.nowMs())));
    }

    public static boolean isValidTransition(RaceStatus from, RaceStatus to) {
        return ALLOWED.getOrDefault(from, Set.of()).contains(to);
    }

    // ---------------------------------------------------------------------

    private static RaceState bump(RaceState.RaceStateBuilder b) {
        RaceState next = b.build();
        next.setVersion(next.getVersion() + 1);
        return next;
    }

    private static double clamp(double v, double max) {
        return Math.max(0, Math.min(max, v));
    }
}
