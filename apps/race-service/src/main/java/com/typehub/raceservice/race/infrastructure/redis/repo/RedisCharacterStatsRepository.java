package com.typehub.raceservice.race.infrastructure.redis.repo;

import com.typehub.metrics.learning.CharacterConfidence;
import com.typehub.metrics.learning.CharacterStatsRepository;
import com.typehub.raceservice.infrastructure.redis.RedisOps;
import com.typehub.raceservice.race.infrastructure.redis.RaceRedisKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.Map;

/**
 * 逐字母熟练度仓储：Hash 结构，field 为字母本身。
 */
@Repository
@RequiredArgsConstructor
public class RedisCharacterStatsRepository implements CharacterStatsRepository {

    private final RedisOps ops;

    @Override
    public Map<Character, CharacterConfidence> findAll(String userId) {
        Map<Character, CharacterConfidence> out = new HashMap<>();
        ops.hGetAll(RaceRedisKeys.userCharStats(userId)).forEach((field, value) -> {
            if (field.length() == 1 && value instanceof CharacterConfidence c) {
                out.put(field.charAt(0), c);
            }
        });
        return out;
    }

    @Override
    public void saveAll(String userId, Map<Character, CharacterConfidence> stats) {
        if (stats.isEmpty()) return;
        Map<String, Object> fields = new HashMap<>();
        stats.forEach((c, v) -> fields.put(String.valueOf(c), v));
        ops.hSetAll(RaceRedisKeys.userCharStats(userId), fields);
    }

    @Override
    public void deleteAll(String userId) {
        ops.del(RaceRedisKeys.userCharStats(userId));
    }
}
