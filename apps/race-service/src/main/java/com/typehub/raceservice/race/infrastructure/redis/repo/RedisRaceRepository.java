package com.typehub.raceservice.race.infrastructure.redis.repo;

import com.typehub.raceservice.infrastructure.redis.RedisOps;
import com.typehub.raceservice.race.domain.model.RaceState;
import com.typehub.raceservice.race.domain.repository.RaceRepository;
import com.typehub.raceservice.race.infrastructure.redis.RaceRedisKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * RedisRaceRepository
 * -------------------------------------------------------
 * 比赛状态的 Redis 仓储实现。
 * - 存取对象：RaceState（JSON）；
 * - 新建走 SETNX，天然保证房间号唯一；
 * - 更新走 WATCH/MULTI/EXEC，按 version 做 CAS。
 */
@Repository
@RequiredArgsConstructor
public class RedisRaceRepository implements RaceRepository {

    private final RedisOps ops;

    private final RedisTemplate<String, Object> redisTemplate;

    @Value("${race.room.ttl-hours:24}")
    private long roomTtlHours;

    @Override
    public boolean create(RaceState state, Duration ttl) {
        return ops.setNx(RaceRedisKeys.race(state.getRoomCode()), state, ttl);
    }

    @Override
    public Optional<RaceState> findByRoomCode(String roomCode) {
        return Optional.ofNullable(ops.get(RaceRedisKeys.race(roomCode), RaceState.class));
    }

    /**
     * 原子更新比赛状态（CAS 语义）。
     * <p>
     * 对状态键执行 WATCH，校验当前 version 与期望一致后在 MULTI/EXEC 中写入新状态并续期；
     * 提交前键被其他请求修改时 EXEC 返回 null，视为失败。
     */
    @Override
    public boolean updateAtomically(String roomCode, long expectedVersion, RaceState newState) {
        final String key = RaceRedisKeys.race(roomCode);
        final Duration ttl = Duration.ofHours(roomTtlHours);

        Boolean ok = redisTemplate.execute(new SessionCallback<Boolean>() {
            @SuppressWarnings("unchecked")
            @Override
            public <K, V> Boolean execute(RedisOperations<K, V> operations) throws DataAccessException {
                // 1) 监视状态键
                operations.watch((K) key);

                // 2) 读取并校验 version
                Object raw = operations.opsForValue().get((K) key);
                if (!(raw instanceof RaceState cur) || cur.getVersion() != expectedVersion) {
                    operations.unwatch();
                    return false;
                }

                // 3) 事务内写入
                operations.multi();
                operations.opsForValue().set((K) key, (V) newState, ttl);

                // 4) exec 返回 null 代表冲突
                List<Object> res = operations.exec();
                return res != null && !res.isEmpty();
            }
        });
        return Boolean.TRUE.equals(ok);
    }
}
