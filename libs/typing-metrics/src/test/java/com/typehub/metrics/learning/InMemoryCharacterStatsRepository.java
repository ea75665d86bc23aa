package com.typehub.metrics.learning;

import java.util.HashMap;
import java.util.Map;

/** 测试用内存仓储 */
class InMemoryCharacterStatsRepository implements CharacterStatsRepository {

    private final Map<String, Map<Character, CharacterConfidence>> store = new HashMap<>();

    @Override
    public Map<Character, CharacterConfidence> findAll(String userId) {
        return new HashMap<>(store.getOrDefault(userId, Map.of()));
    }

    @Override
    public void saveAll(String userId, Map<Character, CharacterConfidence> stats) {
        store.computeIfAbsent(userId, k -> new HashMap<>()).putAll(stats);
    }

    @Override
    public void deleteAll(String userId) {
        store.remove(userId);
    }
}
