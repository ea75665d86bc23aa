package com.typehub.raceservice.race.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.typehub.raceservice.race.domain.enums.RaceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RaceState
 * -------------------------------------------------------
 * 一场 1v1 比赛的完整状态（状态机的输入与输出）。
 * -------------------------------------------------------
 * - version：每次成功迁移 +1，用于 Redis CAS 与远端快照去重；
 * - 所有时间戳均取自服务端时钟；
 * - 状态机只返回新对象，不修改入参。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RaceState {
    private String id;
    /** 6 位房间号（0-9A-Z） */
    private String roomCode;
    private RaceStatus status;
    private String hostId;
    private PlayerState host;
    private PlayerState opponent;
    /** 比赛文本，开赛后不再变化 */
    private String expectedText;
    private int durationSeconds;
    private boolean botRace;
    private long version;
    private Long countdownStartedAt;
    private Long raceStartedAt;
    private Long raceEndedAt;
    private String winnerId;
    private boolean tie;

    /** 按ID取参赛者，不存在返回 null */
    public PlayerState participant(String participantId) {
        if (participantId == null) return null;
        if (host != null && participantId.equals(host.getId())) return host;
        if (opponent != null && participantId.equals(opponent.getId())) return opponent;
        return null;
    }

    /** 取对手一方（相对于给定参赛者） */
    public PlayerState otherThan(String participantId) {
        if (host != null && host.getId().equals(participantId)) return opponent;
        return host;
    }

    @JsonIgnore
    public boolean isParticipant(String participantId) {
        return participant(participantId) != null;
    }

    @JsonIgnore
    public boolean hasOpponent() {
        return opponent != null;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
