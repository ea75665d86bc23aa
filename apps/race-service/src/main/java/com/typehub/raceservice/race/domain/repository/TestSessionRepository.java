package com.typehub.raceservice.race.domain.repository;

import com.typehub.raceservice.race.domain.dto.TestSessionRecord;

import java.util.List;

/**
 * 单人测试记录仓储：按用户保存最近若干条。
 */
public interface TestSessionRepository {

    void save(TestSessionRecord record);

    /** 最近的记录在前 */
    List<TestSessionRecord> recent(String userId, int limit);
}
