package com.typehub.raceservice.race.interfaces.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class VerifyMetricsRequest {
    @NotBlank
    private String targetText;
    @NotNull
    private List<@NotNull @Valid KeystrokeDto> keystrokes;
    private Double clientRawWpm;
    private Double clientAccuracy;

    /** 首尾按键间隔超过一小时的日志直接拒绝 */
    @JsonIgnore
    @AssertTrue
    public boolean isKeystrokeSpanValid() {
        return KeystrokeDto.spanWithinLimit(keystrokes);
    }
}
