package com.typehub.raceservice.race.domain.repository;

import com.typehub.raceservice.race.domain.dto.RaceResultRecord;

import java.util.Optional;

/**
 * 比赛结果仓储。两个参赛者的协调器都会尝试落库，只保留第一条。
 */
public interface RaceResultRepository {

    /**
     * @return true 表示本次写入生效；false 表示该比赛已有结果
     */
    boolean saveIfAbsent(RaceResultRecord record);

    Optional<RaceResultRecord> findByRaceId(String raceId);
}
