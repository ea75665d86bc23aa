package com.typehub.raceservice.clock.scheduler;

import com.typehub.raceservice.clock.RaceClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.Serializable;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * CountdownSchedulerImpl
 * ---------------------------------------
 * 倒计时引擎的默认实现。
 *
 * 职责：
 *  - 使用 ScheduledThreadPoolExecutor 每秒调度；
 *  - 倒计时状态（key/owner/version/deadline）持久化到 Redis，支持重启恢复；
 *  - Redis SETNX 实现的 holder 锁，保证多节点下只有一个节点执行到期处理；
 *  - 时间统一取自 {@link RaceClock}。
 *
 * 不做的事：
 *  - 不做任何比赛逻辑（开赛、广播）。
 */
public class CountdownSchedulerImpl implements CountdownScheduler {

    private static final Logger log = LoggerFactory.getLogger(CountdownSchedulerImpl.class);

    private static final Duration STATE_TTL = Duration.ofHours(24);
    private static final Duration HOLDER_TTL = Duration.ofSeconds(10);

    private final RedisTemplate<String, Object> redis;
    private final ScheduledThreadPoolExecutor scheduler;
    private final RaceClock clock;

    // 本节点标识，用于 holder 锁
    @Value("${instance.id:${spring.application.name}-${random.value}}")
    private String nodeId;

    private volatile TickListener tickListener;

    // key -> 任务句柄
    private final ConcurrentMap<String, ScheduledFuture<?>> activeTasks = new ConcurrentHashMap<>();

    public CountdownSchedulerImpl(RedisTemplate<String, Object> redis,
                                  ScheduledThreadPoolExecutor scheduler,
                                  RaceClock clock) {
        this.redis = redis;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public void setTickListener(TickListener listener) {
        this.tickListener = listener;
    }

    /**
     * 启动或续上倒计时；已到期则直接尝试触发超时，不再调度。
     */
    @Override
    public void startOrResume(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout) {
        // 防止重复任务：先取消老任务
        stop(key);
        CountdownState state = new CountdownState(key, owner, version, deadlineEpochMs);
        saveState(state);
        long remainMs = state.deadlineEpochMs - clock.nowMs();
        if (remainMs <= 0) {
            if (tryAcquireHolder(key)) {
                safeTimeout(onTimeout, state);
            }
            return;
        }
        // 立即首帧 TICK
        fireTick(state);
        schedule(state, onTimeout);
    }

    /**
     * 停止调度任务（不打断正在执行），并清理 Redis 中的状态与 holder 锁。
     */
    @Override
    public void stop(String key) {
        ScheduledFuture<?> f = activeTasks.remove(key);
        if (f != null) f.cancel(false);
        try {
            redis.delete(stateKey(key));
            redis.delete(holderKey(key));
        } catch (RuntimeException e) {
            log.warn("清理倒计时状态失败: key={}, err={}", key, e.getMessage());
        }
    }

    /**
     * 扫描 Redis 中的倒计时：过期则清理并尝试超时，未过期则重新调度。
     */
    @Override
    public int restoreAllActive(TimeoutHandler onTimeout) {
        Set<String> keys = redis.keys(stateKey("*"));
        if (keys == null || keys.isEmpty()) return 0;
        int restored = 0;
        int expiredHandled = 0;
        for (String redisKey : keys) {
            // holder 锁键也匹配通配符，跳过
            if (redisKey.startsWith(holderKey(""))) continue;
            Object raw = redis.opsForValue().get(redisKey);
            if (!(raw instanceof CountdownState st)) continue;
            long remainMs = st.deadlineEpochMs - clock.nowMs();
            if (remainMs <= 0) {
                redis.delete(redisKey);
                if (tryAcquireHolder(st.key)) {
                    safeTimeout(onTimeout, st);
                    expiredHandled++;
                }
                continue;
            }
            fireTick(st);
            schedule(st, onTimeout);
            restored++;
        }
        log.info("Countdown restoreAllActive done: restored={}, expiredHandled={}", restored, expiredHandled);
        return restored;
    }

    private void schedule(CountdownState state, TimeoutHandler onTimeout) {
        ScheduledFuture<?> fut = scheduler.scheduleAtFixedRate(
                () -> tickTask(state, onTimeout), 1, 1, TimeUnit.SECONDS);
        activeTasks.put(state.key, fut);
    }

    /**
     * 周期任务：以 Redis 为准读取状态，到期则抢 holder 并触发超时，否则推一帧 TICK。
     */
    private void tickTask(CountdownState state, TimeoutHandler onTimeout) {
        CountdownState latest = loadState(state.key);
        // 状态不存在 → 已被停止
        if (latest == null) {
            ScheduledFuture<?> f = activeTasks.remove(state.key);
            if (f != null) f.cancel(false);
            return;
        }
        long remainMs = latest.deadlineEpochMs - clock.nowMs();
        if (remainMs <= 0) {
            if (tryAcquireHolder(state.key)) {
                stop(state.key);
                safeTimeout(onTimeout, latest);
            }
            return;
        }
        fireTick(latest);
    }

    private void fireTick(CountdownState state) {
        TickListener l = tickListener;
        if (l == null) return;
        // 向上取整，3 秒倒计时首帧显示 3
        long left = Math.max(0, (state.deadlineEpochMs - clock.nowMs() + 999) / 1000);
        try {
            l.onTick(state.key, state.owner, state.deadlineEpochMs, left);
        } catch (RuntimeException e) {
            log.warn("倒计时 TICK 回调异常: key={}, err={}", state.key, e.getMessage());
        }
    }

    private void safeTimeout(TimeoutHandler onTimeout, CountdownState state) {
        if (onTimeout == null) return;
        try {
            onTimeout.onTimeout(state.key, state.owner, state.version);
        } catch (RuntimeException e) {
            log.error("倒计时到期回调异常: key={}", state.key, e);
        }
    }

    /**
     * 尝试获取分布式 holder 锁（SETNX，过期10s）。
     */
    private boolean tryAcquireHolder(String key) {
        Boolean ok = redis.opsForValue().setIfAbsent(holderKey(key), nodeId, HOLDER_TTL);
        return Boolean.TRUE.equals(ok);
    }

    private void saveState(CountdownState st) {
        redis.opsForValue().set(stateKey(st.key), st, STATE_TTL);
    }

    private CountdownState loadState(String key) {
        Object raw = redis.opsForValue().get(stateKey(key));
        return raw instanceof CountdownState st ? st : null;
    }

    private String stateKey(String key) { return "countdown:" + key; }

    private String holderKey(String key) { return "countdown:holder:" + key; }

    /**
     * 倒计时状态
     */
    public static class CountdownState implements Serializable {
        public String key;
        public String owner;
        public String version;
        public long deadlineEpochMs;
        public CountdownState() {}
        public CountdownState(String key, String owner, String version, long deadlineEpochMs) {
            this.key = key; this.owner = owner; this.version = version; this.deadlineEpochMs = deadlineEpochMs;
        }
    }
}
