package com.typehub.metrics.learning;

import java.util.Map;

/**
 * 按用户存取逐字母熟练度。实现方负责持久化介质（应用内为 Redis Hash）。
 */
public interface CharacterStatsRepository {

    /**
     * 读取用户全部字母统计。
     * @param userId 用户ID
     * @return 字母 -> 统计；没有数据时返回空 Map
     */
    Map<Character, CharacterConfidence> findAll(String userId);

    /**
     * 覆盖写入若干字母的统计（未出现的字母保持不变）。
     */
    void saveAll(String userId, Map<Character, CharacterConfidence> stats);

    /** 清空用户的学习进度 */
    void deleteAll(String userId);
}
