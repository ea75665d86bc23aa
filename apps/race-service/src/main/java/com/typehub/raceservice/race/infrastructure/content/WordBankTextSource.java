package com.typehub.raceservice.race.infrastructure.content;

import com.typehub.metrics.WordBank;
import com.typehub.raceservice.race.domain.content.RaceTextSource;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;

/**
 * 默认文本来源：从内置词库随机抽词，词数按 100 词/分钟估算。
 */
@Component
public class WordBankTextSource implements RaceTextSource {

    private final Random random = new SecureRandom();

    @Override
    public String textFor(int durationSeconds) {
        return WordBank.randomText(WordBank.wordCountFor(durationSeconds), random);
    }
}
