package com.typehub.raceservice.race.domain.bot;

import com.typehub.raceservice.race.domain.constants.RaceMessages;

import java.util.Locale;

/**
 * 机器人等级
 */
public enum BotLevel {
    BEGINNER("新手", new BotProfile(40, 5, 0.05, 300, 600, BotProfile.DEFAULT_SIGMA)),
    INTERMEDIATE("进阶", new BotProfile(70, 8, 0.03, 200, 400, BotProfile.DEFAULT_SIGMA)),
    PRO("高手", new BotProfile(100, 10, 0.015, 120, 250, BotProfile.DEFAULT_SIGMA));

    private final String displayName;
    private final BotProfile profile;

    BotLevel(String displayName, BotProfile profile) {
        this.displayName = displayName;
        this.profile = profile;
    }

    public String displayName() {
        return displayName;
    }

    public BotProfile profile() {
        return profile;
    }

    /** 机器人在比赛里的参赛者ID */
    public String participantId() {
        return "BOT_" + name();
    }

    /**
     * 宽松解析（忽略大小写），未知等级抛 IllegalArgumentException。
     */
    public static BotLevel parse(String raw) {
        if (raw == null) throw new IllegalArgumentException(RaceMessages.BOT_LEVEL_INVALID);
        try {
            return BotLevel.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(RaceMessages.BOT_LEVEL_INVALID + ": " + raw, e);
        }
    }
}
