package com.typehub.raceservice.race.domain.constants;

/**
 * 比赛相关的提示信息常量。
 */
public final class RaceMessages {

    private RaceMessages() {}

    // 房间
    public static final String ROOM_NOT_FOUND = "房间不存在或已过期";
    public static final String ROOM_CODE_INVALID = "房间号格式不正确";
    public static final String ROOM_FULL = "房间已满";
    public static final String CANNOT_JOIN_OWN_RACE = "不能加入自己创建的比赛";
    public static final String RACE_ALREADY_STARTED = "比赛已开始，无法加入";

    // 状态迁移
    public static final String NEED_OPPONENT = "还没有对手，无法开始";
    public static final String HOST_ONLY = "只有房主可以开始比赛";
    public static final String NOT_IN_COUNTDOWN = "比赛尚未进入倒计时";
    public static final String NOT_ACTIVE = "比赛未在进行中";
    public static final String NOT_A_PARTICIPANT = "不是本场比赛的参赛者";
    public static final String CONCURRENT_UPDATE = "比赛状态已被其他请求修改，请重试";

    // 输入
    public static final String TEXT_REQUIRED = "比赛文本不能为空";
    public static final String DURATION_INVALID = "比赛时长必须为正数";
    public static final String BOT_LEVEL_INVALID = "未知的机器人等级";
}
