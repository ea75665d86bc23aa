package com.typehub.raceservice.race.infrastructure.redis.repo;

import com.typehub.raceservice.infrastructure.redis.RedisOps;
import com.typehub.raceservice.race.domain.dto.TestSessionRecord;
import com.typehub.raceservice.race.domain.repository.TestSessionRepository;
import com.typehub.raceservice.race.infrastructure.redis.RaceRedisKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 单人测试记录：每个用户一个 List，头插并只保留最近 50 条。
 */
@Repository
@RequiredArgsConstructor
public class RedisTestSessionRepository implements TestSessionRepository {

    static final int MAX_KEPT = 50;

    private final RedisOps ops;

    @Override
    public void save(TestSessionRecord record) {
        ops.lPushCapped(RaceRedisKeys.userTestSessions(record.getUserId()), record, MAX_KEPT);
    }

    @Override
    public List<TestSessionRecord> recent(String userId, int limit) {
        return ops.lRange(RaceRedisKeys.userTestSessions(userId), Math.min(limit, MAX_KEPT), TestSessionRecord.class);
    }
}
