package com.typehub.raceservice.race.domain.enums;

/**
 * 比赛阶段：WAITING → COUNTDOWN → ACTIVE → {COMPLETED, CANCELLED}
 */
public enum RaceStatus {
    /** 已建房，等待对手 */
    WAITING,
    /** 开赛倒计时中 */
    COUNTDOWN,
    /** 比赛进行中 */
    ACTIVE,
    /** 正常结束 */
    COMPLETED,
    /** 被取消 */
    CANCELLED;

    /** 终态不可再迁移 */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
