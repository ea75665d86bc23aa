package com.typehub.raceservice.race.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单人测试的结算记录，数值全部由服务端根据按键日志重算。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestSessionRecord {
    private String sessionId;
    private String userId;
    /** 测试模式（time / words / learn ...），原样保存 */
    private String mode;
    private int durationSeconds;
    private double rawWpm;
    private double netWpm;
    private double accuracy;
    private double consistency;
    private int totalCharacters;
    private int correctCharacters;
    private int errorCount;
    private boolean valid;
    private long createdAt;
}
