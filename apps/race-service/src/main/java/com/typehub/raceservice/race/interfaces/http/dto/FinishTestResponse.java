package com.typehub.raceservice.race.interfaces.http.dto;

import com.typehub.metrics.SessionMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 结算结果：服务端指标、客户端上报值的复核结果、逐字母练习的解锁变化。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinishTestResponse {
    private String sessionId;
    private SessionMetrics metrics;
    private boolean clientMetricsValid;
    private List<String> verificationErrors;
    private List<Character> newlyUnlocked;
    private Character nextToUnlock;
}
