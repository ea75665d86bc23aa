package com.typehub.raceservice.race.application;

import com.typehub.metrics.KeystrokeRecord;
import com.typehub.metrics.LiveStats;
import com.typehub.metrics.MetricsKernel;
import com.typehub.raceservice.clock.RaceClock;
import com.typehub.raceservice.clock.RaceTimer;
import com.typehub.raceservice.race.domain.bot.BotProgress;
import com.typehub.raceservice.race.domain.bot.BotRunner;
import com.typehub.raceservice.race.domain.channel.RaceChannel;
import com.typehub.raceservice.race.domain.constants.RaceMessages;
import com.typehub.raceservice.race.domain.dto.RaceResultRecord;
import com.typehub.raceservice.race.domain.enums.RaceStatus;
import com.typehub.raceservice.race.domain.model.PlayerState;
import com.typehub.raceservice.race.domain.model.RaceSnapshot;
import com.typehub.raceservice.race.domain.model.RaceState;
import com.typehub.raceservice.race.domain.repository.RaceResultRepository;
import com.typehub.raceservice.race.domain.rule.RaceStateException;
import com.typehub.raceservice.race.domain.rule.RaceStateMachine;
import com.typehub.raceservice.race.domain.rule.Transition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RaceCoordinator
 * -------------------------------------------------
 * 单个参赛者视角的比赛引擎（应用编排层）：一场真人对战有两个实例，人机对战只有一个。
 *
 * 职责与边界：
 * 1) begin：以服务端开赛时间为基准启动时长计时；人机对战每 50ms 驱动一次机器人，
 *    真人对战订阅比赛通道；
 * 2) onLocalInput：把本地输入与上一次比较得出按键（按服务端时间打点），用指标内核算实时成绩，
 *    写入本地参赛者；向通道发布快照，200ms 内至多一次（首次立即发，其余合并为一次补发）；
 * 3) onRemoteSnapshot：只合并对手自己的字段；过期/重复版本、关于本地参赛者的快照一律丢弃；
 *    对手已取消或已结束时本地随之结束；
 * 4) 结束条件取先到者：任一方进度到 100，或比赛时长到期。结束时停掉所有定时器，
 *    用按键日志重算本地终局成绩，判定胜负，发布最终快照并落库。
 *
 * 重要说明：
 * - 所有入口方法 synchronized，定时器回调与网络回调在同一把锁下串行；
 * - 结束或取消后进入冻结状态，之后的输入与快照全部忽略；
 * - 通道、落库异常只记日志，不影响本地比赛继续。
 */
@Slf4j
public class RaceCoordinator {

    /**
     * 可调参数
     * @param publishThrottleMs 快照发布最小间隔
     * @param botTickMs         机器人 tick 周期
     */
    public record Settings(long publishThrottleMs, long botTickMs) {
        public static final Settings DEFAULTS = new Settings(200, BotRunner.DEFAULT_TICK_MS);
    }

    private final String localId;
    private final RaceStateMachine machine;
    private final RaceChannel channel;
    private final RaceClock clock;
    private final RaceTimer timer;
    private final RaceResultRepository results;
    private final RaceCoordinatorListener listener;
    private final BotRunner bot;
    private final Settings settings;

    private RaceState state;
    private final List<KeystrokeRecord> keystrokes = new ArrayList<>();
    private String typed = "";
    private boolean backspaceUsed;

    private boolean begun;
    private volatile boolean frozen;
    private boolean published;
    private long lastPublishAt;
    private long lastRemoteVersion = -1;

    private RaceTimer.Cancellable durationTimer;
    private RaceTimer.Cancellable botTicker;
    private RaceTimer.Cancellable pendingFlush;
    private RaceChannel.Subscription subscription;

    /**
     * @param channel 真人对战的进度通道；人机对战传 null
     * @param bot     人机对战的机器人；真人对战传 null
     */
    public RaceCoordinator(String localId,
                           RaceStateMachine machine,
                           RaceChannel channel,
                           RaceClock clock,
                           RaceTimer timer,
                           RaceResultRepository results,
                           RaceCoordinatorListener listener,
                           BotRunner bot,
                           Settings settings) {
        this.localId = localId;
        this.machine = machine;
        this.channel = channel;
        this.clock = clock;
        this.timer = timer;
        this.results = results;
        this.listener = listener == null ? RaceCoordinatorListener.NOOP : listener;
        this.bot = bot;
        this.settings = settings == null ? Settings.DEFAULTS : settings;
    }

    /**
     * 比赛开始：启动时长计时，以及机器人 tick 或通道订阅。重复调用无效。
     * @param active 已进入 ACTIVE 的比赛状态
     */
    public synchronized void begin(RaceState active) {
        if (begun) return;
        if (active.getStatus() != RaceStatus.ACTIVE) {
            throw new RaceStateException(RaceMessages.NOT_ACTIVE);
        }
        if (!active.isParticipant(localId)) {
            throw new RaceStateException(RaceMessages.NOT_A_PARTICIPANT);
        }
        begun = true;
        state = active;

        long startedAt = active.getRaceStartedAt() == null ? clock.nowMs() : active.getRaceStartedAt();
        long remaining = active.getDurationSeconds() * 1000L - (clock.nowMs() - startedAt);
        durationTimer = timer.schedule(this::onDurationElapsed, Math.max(0, remaining));

        if (bot != null) {
            bot.start(clock.nowMs());
            botTicker = timer.scheduleAtFixedRate(this::onBotTick, settings.botTickMs());
        } else if (channel != null) {
            subscription = channel.subscribe(RaceChannel.keyOf(active.getRoomCode()), this::onRemoteSnapshot);
        }
        log.info("比赛开始: raceId={}, roomCode={}, local={}, bot={}, remainingMs={}",
                active.getId(), active.getRoomCode(), localId, bot != null, remaining);
    }

    /**
     * 本地输入变化。
     * @param newText 当前完整输入
     */
    public synchronized void onLocalInput(String newText) {
        if (!begun || frozen) return;
        String text = newText == null ? "" : newText;
        long now = clock.nowMs();
        recordKeystrokes(typed, text, now);
        typed = text;

        LiveStats live = MetricsKernel.liveStats(typed, state.getExpectedText(),
                now - raceStartedAt(), backspaceUsed);
        apply(machine.updateProgress(state, localId, live.progress(), live.netWpm(), live.accuracy()));
        listener.onProgress(state, state.participant(localId), true);

        if (!checkFinish()) {
            schedulePublish(now);
        }
    }

    /**
     * 收到通道快照。
     */
    public synchronized void onRemoteSnapshot(RaceSnapshot snapshot) {
        if (!begun || frozen) return;
        if (snapshot == null || snapshot.getSenderId() == null || snapshot.getParticipant() == null
                || snapshot.getParticipant().getId() == null) {
            log.warn("丢弃不完整的比赛快照: raceId={}, local={}", state.getId(), localId);
            return;
        }
        PlayerState remote = snapshot.getParticipant();
        // 自己发出的消息回流
        if (localId.equals(snapshot.getSenderId()) || localId.equals(remote.getId())) return;
        if (!remote.getId().equals(snapshot.getSenderId()) || !state.isParticipant(remote.getId())) {
            log.warn("丢弃非本场参赛者的快照: raceId={}, sender={}", state.getId(), snapshot.getSenderId());
            return;
        }
        if (snapshot.getVersion() <= lastRemoteVersion) {
            log.debug("丢弃过期快照: raceId={}, version={}, last={}",
                    state.getId(), snapshot.getVersion(), lastRemoteVersion);
            return;
        }
        lastRemoteVersion = snapshot.getVersion();

        if (snapshot.getStatus() == RaceStatus.CANCELLED) {
            log.info("对手取消了比赛: raceId={}, by={}", state.getId(), remote.getId());
            cancelLocally(false);
            return;
        }

        apply(machine.updateProgress(state, remote.getId(),
                remote.getProgress(), remote.getWpm(), remote.getAccuracy(), remote.getFinishedAt()));
        listener.onProgress(state, state.participant(remote.getId()), false);

        if (snapshot.getStatus() == RaceStatus.COMPLETED) {
            finish("peer-completed");
            return;
        }
        checkFinish();
    }

    /**
     * 本地主动取消并通知对手。
     */
    public synchronized void cancel() {
        if (frozen) return;
        if (!begun) {
            frozen = true;
            return;
        }
        cancelLocally(true);
    }

    public synchronized RaceState view() {
        return state;
    }

    public String localParticipantId() {
        return localId;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public synchronized List<KeystrokeRecord> keystrokes() {
        return Collections.unmodifiableList(new ArrayList<>(keystrokes));
    }

    // ------------------------------------------------------------------ 定时回调

    private synchronized void onDurationElapsed() {
        if (frozen) return;
        finish("time-up");
    }

    private synchronized void onBotTick() {
        if (frozen) return;
        BotProgress p = bot.tick();
        apply(machine.updateProgress(state, botId(), p.progress(), p.wpm(), p.accuracy()));
        listener.onProgress(state, state.participant(botId()), true);
        checkFinish();
    }

    private synchronized void flushPending() {
        pendingFlush = null;
        if (frozen) return;
        publishNow(clock.nowMs());
    }

    // ------------------------------------------------------------------ 内部

    private boolean checkFinish() {
        PlayerState h = state.getHost();
        PlayerState o = state.getOpponent();
        boolean someoneDone = h.getProgress() >= 100 || (o != null && o.getProgress() >= 100);
        if (someoneDone) {
            finish("completed-text");
        }
        return someoneDone;
    }

    private void finish(String reason) {
        if (frozen) return;
        frozen = true;
        stopTimers();

        // 本地参赛者的终局成绩以按键日志重算为准
        LiveStats fin = MetricsKernel.finalRaceStats(keystrokes, typed, state.getExpectedText());
        apply(machine.updateProgress(state, localId, fin.progress(), fin.netWpm(), fin.accuracy()));
        if (bot != null) {
            BotProgress b = bot.finalProgress();
            apply(machine.updateProgress(state, botId(), b.progress(), b.wpm(), b.accuracy()));
        }
        apply(machine.completeRace(state));
        log.info("比赛结束: raceId={}, local={}, reason={}, winner={}, tie={}",
                state.getId(), localId, reason, state.getWinnerId(), state.isTie());

        if (channel != null) {
            publishNow(clock.nowMs());
        }
        closeSubscription();
        persistResult();
        listener.onFinished(state);
    }

    private void cancelLocally(boolean notifyPeer) {
        frozen = true;
        stopTimers();
        apply(machine.cancelRace(state));
        if (notifyPeer && channel != null) {
            publishNow(clock.nowMs());
        }
        closeSubscription();
        log.info("比赛取消: raceId={}, local={}", state.getId(), localId);
        listener.onCancelled(state);
    }

    private void schedulePublish(long now) {
        if (channel == null) return;
        if (!published || now - lastPublishAt >= settings.publishThrottleMs()) {
            publishNow(now);
        } else if (pendingFlush == null) {
            long wait = lastPublishAt + settings.publishThrottleMs() - now;
            log.debug("节流合并发布: raceId={}, local={}, waitMs={}", state.getId(), localId, wait);
            pendingFlush = timer.schedule(this::flushPending, wait);
        }
    }

    private void publishNow(long now) {
        RaceSnapshot snapshot = RaceSnapshot.builder()
                .raceId(state.getId())
                .roomCode(state.getRoomCode())
                .senderId(localId)
                .version(state.getVersion())
                .status(state.getStatus())
                .participant(state.participant(localId))
                .winnerId(state.getWinnerId())
                .tie(state.isTie())
                .sentAt(now)
                .build();
        published = true;
        lastPublishAt = now;
        try {
            channel.publish(RaceChannel.keyOf(state.getRoomCode()), snapshot);
        } catch (RuntimeException e) {
            log.warn("发布比赛快照失败: raceId={}, local={}, err={}", state.getId(), localId, e.getMessage());
        }
    }

    private void persistResult() {
        if (state.getStatus() != RaceStatus.COMPLETED) return;
        try {
            boolean first = results.saveIfAbsent(RaceResultRecord.from(state));
            log.debug("比赛结果落库: raceId={}, first={}", state.getId(), first);
        } catch (RuntimeException e) {
            log.warn("比赛结果落库失败: raceId={}, err={}", state.getId(), e.getMessage());
        }
    }

    /**
     * 对比新旧输入生成按键记录：先为删掉的字符记退格，再为新增字符记按下。
     */
    private void recordKeystrokes(String before, String after, long now) {
        String target = state.getExpectedText();
        int common = 0;
        int max = Math.min(before.length(), after.length());
        while (common < max && before.charAt(common) == after.charAt(common)) common++;

        for (int i = before.length() - 1; i >= common; i--) {
            keystrokes.add(KeystrokeRecord.backspace(localId, expectedAt(target, i), now, i + 1));
            backspaceUsed = true;
        }
        for (int i = common; i < after.length(); i++) {
            keystrokes.add(KeystrokeRecord.keydown(localId, expectedAt(target, i), after.charAt(i), now, i));
        }
    }

    private static char expectedAt(String target, int index) {
        return index < target.length() ? target.charAt(index) : KeystrokeRecord.NO_CHAR;
    }

    private void stopTimers() {
        if (durationTimer != null) durationTimer.cancel();
        if (botTicker != null) botTicker.cancel();
        if (pendingFlush != null) pendingFlush.cancel();
        durationTimer = null;
        botTicker = null;
        pendingFlush = null;
    }

    private void closeSubscription() {
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
    }

    private long raceStartedAt() {
        return state.getRaceStartedAt() == null ? clock.nowMs() : state.getRaceStartedAt();
    }

    private String botId() {
        return state.otherThan(localId).getId();
    }

    private void apply(Transition t) {
        state = t.state();
    }
}
