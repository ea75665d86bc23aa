package com.typehub.raceservice.race.interfaces.http.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * 建房请求。level 为空表示真人对战，否则为人机对战的机器人等级。
 */
@Data
public class CreateRaceRequest {
    @NotBlank
    private String hostId;
    /** 为空取默认时长 */
    @Positive
    @Max(600)
    private Integer durationSeconds;
    /** BEGINNER / INTERMEDIATE / PRO */
    private String level;
}
