package com.typehub.raceservice.race.domain.model;

import com.typehub.raceservice.race.domain.enums.RaceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 通过比赛通道广播的快照：只携带发送方自己的参赛者数据。
 * version 为发送方本地视图的版本号，单调递增，接收方据此丢弃过期/重复快照。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RaceSnapshot {
    private String raceId;
    private String roomCode;
    private String senderId;
    private long version;
    private RaceStatus status;
    private PlayerState participant;
    private String winnerId;
    private boolean tie;
    private long sentAt;
}
