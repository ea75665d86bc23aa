package com.typehub.raceservice.race.infrastructure.redis.repo;

import com.typehub.raceservice.infrastructure.redis.RedisOps;
import com.typehub.raceservice.race.domain.dto.RaceResultRecord;
import com.typehub.raceservice.race.domain.repository.RaceResultRepository;
import com.typehub.raceservice.race.infrastructure.redis.RaceRedisKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * 比赛结果仓储：SETNX 写入，同一比赛只保留第一条结果，保留 30 天。
 */
@Repository
@RequiredArgsConstructor
public class RedisRaceResultRepository implements RaceResultRepository {

    private static final Duration RESULT_TTL = Duration.ofDays(30);

    private final RedisOps ops;

    @Override
    public boolean saveIfAbsent(RaceResultRecord record) {
        return ops.setNx(RaceRedisKeys.raceResult(record.getRaceId()), record, RESULT_TTL);
    }

    @Override
    public Optional<RaceResultRecord> findByRaceId(String raceId) {
        return Optional.ofNullable(ops.get(RaceRedisKeys.raceResult(raceId), RaceResultRecord.class));
    }
}
