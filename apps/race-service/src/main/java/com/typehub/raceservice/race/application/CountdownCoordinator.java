package com.typehub.raceservice.race.application;

import com.typehub.raceservice.clock.scheduler.CountdownScheduler;
import com.typehub.raceservice.race.domain.model.RaceState;
import com.typehub.raceservice.race.interfaces.ws.dto.RaceWsMessages;
import com.typehub.raceservice.race.service.RaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * CountdownCoordinator
 * -------------------------------------------------
 * 开赛倒计时协调器（应用编排层）：将通用倒计时引擎与比赛生命周期对接。
 *
 * 职责与边界：
 * 1) 应用启动时注册 tick 监听（转成房间内的 COUNTDOWN 事件），并恢复重启前未走完的倒计时；
 * 2) 房主开始倒计时后由 RaceService 调用 start，截止时间 = countdownStartedAt + 倒计时秒数；
 * 3) 到期回调交给 RaceService.onCountdownElapsed 做权威开赛（CAS + 启动协调器）。
 *
 * 本类不管理线程池与 Redis，也不做状态迁移。
 */
@Component
public class CountdownCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CountdownCoordinator.class);

    private static final String KEY_PREFIX = "race:";

    private final CountdownScheduler scheduler;
    private final RaceService raceService;
    private final RaceEventPublisher events;

    @Value("${race.countdown.seconds:3}")
    private int countdownSeconds;

    public CountdownCoordinator(CountdownScheduler scheduler,
                                @Lazy RaceService raceService,
                                RaceEventPublisher events) {
        this.scheduler = scheduler;
        this.raceService = raceService;
        this.events = events;
    }

    /**
     * 注册 TICK 转发并恢复活跃倒计时。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        scheduler.setTickListener((key, raceId, deadlineMs, left) -> {
            String roomCode = extractRoomCode(key);
            events.send(roomCode, raceId, RaceWsMessages.COUNTDOWN, Map.of(
                    "left", left,
                    "deadlineEpochMs", deadlineMs));
        });
        int restored = scheduler.restoreAllActive((key, raceId, version) -> handleTimeout(key));
        log.info("倒计时协调器启动完成：已恢复 {} 个开赛倒计时", restored);
    }

    /**
     * 为进入 COUNTDOWN 的比赛启动倒计时。
     * @return 截止时间（毫秒）
     */
    public long start(RaceState countdown) {
        long startedAt = countdown.getCountdownStartedAt();
        long deadline = startedAt + countdownSeconds * 1000L;
        scheduler.startOrResume(key(countdown.getRoomCode()), countdown.getId(), deadline,
                String.valueOf(countdown.getVersion()), (k, raceId, v) -> handleTimeout(k));
        log.info("开赛倒计时启动: roomCode={}, deadline={}", countdown.getRoomCode(), deadline);
        return deadline;
    }

    public void stop(String roomCode) {
        scheduler.stop(key(roomCode));
    }

    private void handleTimeout(String key) {
        String roomCode = extractRoomCode(key);
        log.info("开赛倒计时结束: roomCode={}", roomCode);
        raceService.onCountdownElapsed(roomCode);
    }

    private static String key(String roomCode) { return KEY_PREFIX + roomCode; }

    private static String extractRoomCode(String key) {
        return key.startsWith(KEY_PREFIX) ? key.substring(KEY_PREFIX.length()) : key;
    }
}
