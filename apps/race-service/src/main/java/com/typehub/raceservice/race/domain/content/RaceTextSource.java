package com.typehub.raceservice.race.domain.content;

/**
 * 比赛文本来源。
 */
public interface RaceTextSource {

    /**
     * 生成足够在给定时长内打完的文本。
     */
    String textFor(int durationSeconds);
}
