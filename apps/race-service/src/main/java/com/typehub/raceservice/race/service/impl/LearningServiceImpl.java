package com.typehub.raceservice.race.service.impl;

import com.typehub.metrics.learning.AdaptiveLearningEngine;
import com.typehub.metrics.learning.AdaptiveLearningEngine.Lesson;
import com.typehub.metrics.learning.CharacterConfidence;
import com.typehub.raceservice.race.service.LearningService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.List;
import java.util.Random;

/**
 * 逐字母练习：对 {@link AdaptiveLearningEngine} 的薄封装。
 */
@Service
@RequiredArgsConstructor
public class LearningServiceImpl implements LearningService {

    private static final int MAX_LESSON_WORDS = 200;

    private final AdaptiveLearningEngine engine;
    private final Random random = new SecureRandom();

    @Override
    public List<CharacterConfidence> letterStats(String userId) {
        return engine.allStats(userId);
    }

    @Override
    public Lesson nextLesson(String userId, int wordCount) {
        if (wordCount <= 0 || wordCount > MAX_LESSON_WORDS) {
            throw new IllegalArgumentException("wordCount 必须在 1~" + MAX_LESSON_WORDS + " 之间");
        }
        return engine.lesson(userId, wordCount, random);
    }

    @Override
    public void reset(String userId) {
        engine.reset(userId);
    }
}
