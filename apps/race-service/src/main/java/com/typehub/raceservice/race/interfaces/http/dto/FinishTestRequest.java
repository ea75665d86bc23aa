package com.typehub.raceservice.race.interfaces.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * 单人测试结算请求：客户端只提供按键日志，成绩由服务端重算。
 * clientRawWpm / clientAccuracy 仅用于复核，不参与存储。
 */
@Data
public class FinishTestRequest {
    @NotBlank
    private String userId;
    @NotBlank
    private String targetText;
    @NotNull
    private List<@NotNull @Valid KeystrokeDto> keystrokes;
    @NotBlank
    private String mode;
    private Integer durationSeconds;
    private Double clientRawWpm;
    private Double clientAccuracy;

    /** 首尾按键间隔超过一小时的日志直接拒绝 */
    @JsonIgnore
    @AssertTrue
    public boolean isKeystrokeSpanValid() {
        return KeystrokeDto.spanWithinLimit(keystrokes);
    }
}
