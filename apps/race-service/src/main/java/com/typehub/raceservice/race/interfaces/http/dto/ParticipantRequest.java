package com.typehub.raceservice.race.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 只带参赛者ID的请求（加入、开始倒计时、取消、提交输入）。
 */
@Data
public class ParticipantRequest {
    @NotBlank
    private String participantId;
    /** 仅提交输入时使用 */
    private String typedText;
}
