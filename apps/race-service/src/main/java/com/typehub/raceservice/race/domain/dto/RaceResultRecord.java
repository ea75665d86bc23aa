package com.typehub.raceservice.race.domain.dto;

import com.typehub.raceservice.race.domain.model.PlayerState;
import com.typehub.raceservice.race.domain.model.RaceState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 比赛结果持久化记录（每场比赛一条，先写者为准）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RaceResultRecord {
    private String raceId;
    private String roomCode;
    private String winnerId;
    private boolean tie;
    private boolean botRace;
    private String hostId;
    private double hostWpm;
    private double hostAccuracy;
    private double hostProgress;
    private String opponentId;
    private double opponentWpm;
    private double opponentAccuracy;
    private double opponentProgress;
    private Long raceStartedAt;
    private Long raceEndedAt;

    public static RaceResultRecord from(RaceState s) {
        PlayerState h = s.getHost();
        PlayerState o = s.getOpponent();
        RaceResultRecordBuilder b = RaceResultRecord.builder()
                .raceId(s.getId())
                .roomCode(s.getRoomCode())
                .winnerId(s.getWinnerId())
                .tie(s.isTie())
                .botRace(s.isBotRace())
                .hostId(h.getId())
                .hostWpm(h.getWpm())
                .hostAccuracy(h.getAccuracy())
                .hostProgress(h.getProgress())
                .raceStartedAt(s.getRaceStartedAt())
                .raceEndedAt(s.getRaceEndedAt());
        if (o != null) {
            b.opponentId(o.getId())
                    .opponentWpm(o.getWpm())
                    .opponentAccuracy(o.getAccuracy())
                    .opponentProgress(o.getProgress());
        }
        return b.build();
    }
}
