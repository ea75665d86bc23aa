package com.typehub.raceservice.race.infrastructure.redis;

/**
 * 统一集中管理比赛相关的 Redis Key。
 */
public final class RaceRedisKeys {

    private static final String PFX = "typehub:";

    private RaceRedisKeys() {}

    // ---- 比赛生命周期状态（按房间号） ----
    public static String race(String roomCode) {
        return PFX + "race:" + roomCode;
    }

    // ---- 比赛结果（按比赛ID，SETNX 先写者为准） ----
    public static String raceResult(String raceId) {
        return PFX + "race:result:" + raceId;
    }

    // ---- 用户最近的单人测试 ----
    public static String userTestSessions(String userId) {
        return PFX + "user:" + userId + ":tests";
    }

    // ---- 用户逐字母熟练度（Hash：字母 -> CharacterConfidence） ----
    public static String userCharStats(String userId) {
        return PFX + "user:" + userId + ":chars";
    }
}
