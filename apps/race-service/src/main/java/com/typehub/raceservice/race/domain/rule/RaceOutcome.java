package com.typehub.raceservice.race.domain.rule;

/**
 * 比赛判定结果。tie=true 时 winnerId 为 null。
 */
public record RaceOutcome(String winnerId, boolean tie) {

    public static RaceOutcome win(String winnerId) {
        return new RaceOutcome(winnerId, false);
    }

    public static RaceOutcome draw() {
        return new RaceOutcome(null, true);
    }
}
