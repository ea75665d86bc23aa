package com.typehub.raceservice.race.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SimulateBotRequest {
    /** 与 600 秒比赛词库文本的最大长度对齐 */
    public static final int MAX_TEXT_LENGTH = 10_000;

    @NotBlank
    private String level;
    @NotBlank
    @Size(max = MAX_TEXT_LENGTH)
    private String text;
    /** 为空时随机 */
    private Long seed;
}
