package com.typehub.raceservice.race.domain.repository;

import com.typehub.raceservice.race.domain.model.RaceState;

import java.time.Duration;
import java.util.Optional;

/**
 * RaceRepository
 * ----------------------------------------
 * 比赛生命周期状态仓储（以房间号为键）。
 * - 新建时占用房间号，防止重复；
 * - 之后的修改都走基于 version 的 CAS。
 */
public interface RaceRepository {

    /**
     * 新建比赛；房间号已被占用时返回 false。
     */
    boolean create(RaceState state, Duration ttl);

    Optional<RaceState> findByRoomCode(String roomCode);

    /**
     * CAS 更新：仅当当前存储的 version 等于 expectedVersion 时写入。
     * @return true 表示写入成功；false 表示不存在或已被其他请求修改
     */
    boolean updateAtomically(String roomCode, long expectedVersion, RaceState newState);
}
