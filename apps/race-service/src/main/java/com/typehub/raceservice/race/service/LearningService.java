package com.typehub.raceservice.race.service;

import com.typehub.metrics.learning.AdaptiveLearningEngine.Lesson;
import com.typehub.metrics.learning.CharacterConfidence;

import java.util.List;

/**
 * 逐字母练习服务。
 */
public interface LearningService {

    /** 26 个字母的熟练度与解锁状态 */
    List<CharacterConfidence> letterStats(String userId);

    /** 根据当前解锁情况生成一篇练习 */
    Lesson nextLesson(String userId, int wordCount);

    void reset(String userId);
}
