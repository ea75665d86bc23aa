package com.typehub.raceservice.race.service.impl;

import com.typehub.raceservice.race.application.CountdownCoordinator;
import com.typehub.raceservice.race.application.RaceCoordinator;
import com.typehub.raceservice.race.application.RaceCoordinatorFactory;
import com.typehub.raceservice.race.application.RaceCoordinatorListener;
import com.typehub.raceservice.race.application.RaceEventPublisher;
import com.typehub.raceservice.race.domain.bot.BotLevel;
import com.typehub.raceservice.race.domain.bot.BotProgress;
import com.typehub.raceservice.race.domain.bot.BotRunner;
import com.typehub.raceservice.race.domain.constants.RaceMessages;
import com.typehub.raceservice.race.domain.content.RaceTextSource;
import com.typehub.raceservice.race.domain.enums.RaceStatus;
import com.typehub.raceservice.race.domain.model.PlayerState;
import com.typehub.raceservice.race.domain.model.RaceState;
import com.typehub.raceservice.race.domain.repository.RaceRepository;
import com.typehub.raceservice.race.domain.rule.RaceStateException;
import com.typehub.raceservice.race.domain.rule.RaceStateMachine;
import com.typehub.raceservice.race.domain.rule.Transition;
import com.typehub.raceservice.race.interfaces.ws.dto.RaceWsMessages;
import com.typehub.raceservice.race.service.RaceService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * RaceServiceImpl
 * -------------------------------------------------------
 * 比赛生命周期编排。
 * -------------------------------------------------------
 * Responsibilities:
 *  - 建房 / 加入 / 倒计时 / 开赛 / 取消：状态机决定能否迁移，Redis CAS 保证并发安全；
 *  - 开赛后在本节点持有协调器（按房间号索引），输入直接交给对应参赛者的协调器；
 *  - 协调器回调：进度广播、结束后写回生命周期状态并广播 FINISHED。
 * -------------------------------------------------------
 * 进行中的比赛只存在于开赛节点的内存里；生命周期状态（WAITING..COMPLETED）在 Redis。
 */
@Slf4j
@Service
public class RaceServiceImpl implements RaceService {

    private static final Pattern ROOM_CODE = Pattern.compile("^[0-9A-Z]{6}$");
    private static final String ROOM_CODE_ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final int ROOM_CODE_ATTEMPTS = 10;
    private static final int CAS_ATTEMPTS = 3;

    private final RaceRepository raceRepository;
    private final RaceStateMachine machine;
    private final RaceTextSource textSource;
    private final RaceCoordinatorFactory coordinatorFactory;
    private final CountdownCoordinator countdown;
    private final RaceEventPublisher events;

    private final SecureRandom random = new SecureRandom();

    /** roomCode -> 本节点上该比赛的协调器 */
    private final ConcurrentMap<String, List<RaceCoordinator>> live = new ConcurrentHashMap<>();

    @Value("${race.duration.seconds:30}")
    private int defaultDurationSeconds;

    @Value("${race.room.ttl-hours:24}")
    private long roomTtlHours;

    public RaceServiceImpl(RaceRepository raceRepository,
                           RaceStateMachine machine,
                           RaceTextSource textSource,
                           RaceCoordinatorFactory coordinatorFactory,
                           CountdownCoordinator countdown,
                           RaceEventPublisher events) {
        this.raceRepository = raceRepository;
        this.machine = machine;
        this.textSource = textSource;
        this.coordinatorFactory = coordinatorFactory;
        this.countdown = countdown;
        this.events = events;
    }

    // ==================== 建房 / 加入 ====================

    @Override
    public RaceState createRace(String hostId, Integer durationSeconds) {
        requireId(hostId);
        int duration = durationSeconds == null ? defaultDurationSeconds : durationSeconds;
        String text = textSource.textFor(duration);
        for (int i = 0; i < ROOM_CODE_ATTEMPTS; i++) {
            RaceState state = machine.createRace(UUID.randomUUID().toString(), newRoomCode(), hostId, text, duration);
            if (raceRepository.create(state, roomTtl())) {
                log.info("创建比赛: roomCode={}, raceId={}, host={}, duration={}s",
                        state.getRoomCode(), state.getId(), hostId, duration);
                return state;
            }
        }
        throw new IllegalStateException("房间号分配失败，请重试");
    }

    @Override
    public RaceState createBotRace(String hostId, BotLevel level, Integer durationSeconds) {
        if (level == null) throw new IllegalArgumentException(RaceMessages.BOT_LEVEL_INVALID);
        RaceState created = createRace(hostId, durationSeconds);
        Transition t = mutate(created.getRoomCode(),
                s -> machine.addOpponent(s, level.participantId(), true, level));
        log.info("人机对战入座: roomCode={}, bot={}", created.getRoomCode(), level);
        return t.state();
    }

    @Override
    public RaceState joinRace(String roomCode, String userId) {
        requireId(userId);
        String code = normalize(roomCode);
        RaceState current = load(code);
        if (current.isParticipant(userId)) {
            return current;
        }
        Transition t = mutate(code, s -> machine.addOpponent(s, userId, false, null));
        broadcastState(t.state());
        log.info("加入比赛: roomCode={}, opponent={}", code, userId);
        return t.state();
    }

    @Override
    public RaceState getRace(String roomCode) {
        String code = normalize(roomCode);
        RaceState stored = load(code);
        List<RaceCoordinator> coordinators = live.get(code);
        if (stored.getStatus() == RaceStatus.ACTIVE && coordinators != null && !coordinators.isEmpty()) {
            return coordinators.get(0).view();
        }
        return stored;
    }

    // ==================== 倒计时 / 开赛 ====================

    @Override
    public RaceState startCountdown(String roomCode, String requesterId) {
        String code = normalize(roomCode);
        Transition t = mutate(code, s -> machine.startCountdown(s, requesterId));
        if (t.applied()) {
            countdown.start(t.state());
            broadcastState(t.state());
        }
        return t.state();
    }

    @Override
    public void onCountdownElapsed(String roomCode) {
        Transition t = mutate(roomCode, machine::startRace);
        if (!t.applied()) {
            log.debug("开赛请求被忽略（已开赛或已结束）: roomCode={}", roomCode);
            return;
        }
        RaceState active = t.state();
        List<RaceCoordinator> coordinators = coordinatorFactory.create(active, new RoomListener(roomCode));
        live.put(roomCode, coordinators);
        coordinators.forEach(c -> c.begin(active));
        broadcastState(active);
    }

    // ==================== 输入 / 取消 ====================

    @Override
    public RaceState submitInput(String roomCode, String participantId, String typedText) {
        RaceCoordinator coordinator = coordinatorOf(normalize(roomCode), participantId);
        coordinator.onLocalInput(typedText);
        return coordinator.view();
    }

    @Override
    public RaceState cancelRace(String roomCode, String requesterId) {
        String code = normalize(roomCode);
        RaceState current = load(code);
        if (!current.isParticipant(requesterId)) {
            throw new RaceStateException(RaceMessages.NOT_A_PARTICIPANT);
        }
        if (current.getStatus() == RaceStatus.COUNTDOWN) {
            countdown.stop(code);
        }
        List<RaceCoordinator> coordinators = live.get(code);
        if (coordinators != null) {
            coordinators.stream()
                    .filter(c -> c.localParticipantId().equals(requesterId))
                    .findFirst()
                    .ifPresent(RaceCoordinator::cancel);
        }
        Transition t = mutate(code, machine::cancelRace);
        if (t.applied()) {
            // 倒计时可能在上面读取协调器之后才开赛，取消落库后停掉该房间的全部协调器
            List<RaceCoordinator> started = live.get(code);
            if (started != null) {
                started.forEach(RaceCoordinator::cancel);
            }
            broadcastState(t.state());
        }
        return t.state();
    }

    @Override
    public List<BotProgress> simulateBot(BotLevel level, String text, long seed) {
        if (StringUtils.isEmpty(text)) throw new IllegalArgumentException(RaceMessages.TEXT_REQUIRED);
        return BotRunner.simulateFullRace(level, text, seed);
    }

    // ==================== 内部 ====================

    /**
     * 读 → 状态机 → CAS 写，冲突时重读重试；空操作不写库。
     */
    private Transition mutate(String roomCode, Function<RaceState, Transition> op) {
        for (int i = 0; i < CAS_ATTEMPTS; i++) {
            RaceState current = load(roomCode);
            Transition t = op.apply(current);
            if (!t.applied()) return t;
            if (raceRepository.updateAtomically(roomCode, current.getVersion(), t.state())) {
                return t;
            }
            log.debug("比赛状态 CAS 冲突，重试: roomCode={}, attempt={}", roomCode, i + 1);
        }
        throw new IllegalStateException(RaceMessages.CONCURRENT_UPDATE);
    }

    /**
     * 把协调器的终局视图写回生命周期状态；生命周期已是终态时返回 false。
     */
    private boolean storeTerminal(String roomCode, RaceState terminal) {
        for (int i = 0; i < CAS_ATTEMPTS; i++) {
            RaceState current = raceRepository.findByRoomCode(roomCode).orElse(null);
            if (current == null || current.isTerminal()) return false;
            RaceState next = terminal.toBuilder().version(current.getVersion() + 1).build();
            if (raceRepository.updateAtomically(roomCode, current.getVersion(), next)) {
                return true;
            }
        }
        log.warn("终局状态写回失败: roomCode={}", roomCode);
        return false;
    }

    private RaceCoordinator coordinatorOf(String roomCode, String participantId) {
        List<RaceCoordinator> coordinators = live.get(roomCode);
        if (coordinators != null) {
            for (RaceCoordinator c : coordinators) {
                if (c.localParticipantId().equals(participantId)) return c;
            }
        }
        throw new RaceStateException(RaceMessages.NOT_ACTIVE);
    }

    private void releaseIfDone(String roomCode) {
        live.computeIfPresent(roomCode, (k, list) -> list.stream().allMatch(RaceCoordinator::isFrozen) ? null : list);
    }

    private RaceState load(String roomCode) {
        return raceRepository.findByRoomCode(roomCode)
                .orElseThrow(() -> new IllegalArgumentException(RaceMessages.ROOM_NOT_FOUND));
    }

    private void broadcastState(RaceState state) {
        events.send(state.getRoomCode(), state.getId(), RaceWsMessages.STATE, state);
    }

    private String newRoomCode() {
        StringBuilder sb = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            sb.append(ROOM_CODE_ALPHABET.charAt(random.nextInt(ROOM_CODE_ALPHABET.length())));
        }
        return sb.toString();
    }

    private static String normalize(String roomCode) {
        String code = StringUtils.upperCase(StringUtils.trimToEmpty(roomCode));
        if (!ROOM_CODE.matcher(code).matches()) {
            throw new IllegalArgumentException(RaceMessages.ROOM_CODE_INVALID);
        }
        return code;
    }

    private static void requireId(String id) {
        if (StringUtils.isBlank(id)) throw new IllegalArgumentException("参赛者ID不能为空");
    }

    private Duration roomTtl() {
        return Duration.ofHours(roomTtlHours);
    }

    /**
     * 单个房间的协调器回调。
     */
    private class RoomListener implements RaceCoordinatorListener {

        private final String roomCode;

        RoomListener(String roomCode) {
            this.roomCode = roomCode;
        }

        @Override
        public void onProgress(RaceState view, PlayerState participant, boolean local) {
            // 每个参赛者的进度只由驱动它的协调器广播一次
            if (!local || participant == null) return;
            events.send(roomCode, view.getId(), RaceWsMessages.PROGRESS, participant);
        }

        @Override
        public void onFinished(RaceState finalState) {
            try {
                if (storeTerminal(roomCode, finalState)) {
                    events.send(roomCode, finalState.getId(), RaceWsMessages.FINISHED, Map.of(
                            "state", finalState,
                            "tie", finalState.isTie(),
                            "winnerId", Objects.toString(finalState.getWinnerId(), "")));
                }
            } catch (RuntimeException e) {
                log.warn("比赛结束回调失败: roomCode={}, err={}", roomCode, e.getMessage());
            } finally {
                releaseIfDone(roomCode);
            }
        }

        @Override
        public void onCancelled(RaceState state) {
            try {
                if (storeTerminal(roomCode, state)) {
                    broadcastState(state);
                }
            } catch (RuntimeException e) {
                log.warn("比赛取消回调失败: roomCode={}, err={}", roomCode, e.getMessage());
            } finally {
                releaseIfDone(roomCode);
            }
        }
    }
}
