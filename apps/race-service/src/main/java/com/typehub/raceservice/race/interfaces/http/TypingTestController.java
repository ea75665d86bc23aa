package com.typehub.raceservice.race.interfaces.http;

import com.typehub.metrics.KeystrokeRecord;
import com.typehub.metrics.MetricsVerifier.VerificationResult;
import com.typehub.raceservice.race.domain.dto.TestSessionRecord;
import com.typehub.raceservice.race.interfaces.http.dto.FinishTestRequest;
import com.typehub.raceservice.race.interfaces.http.dto.FinishTestResponse;
import com.typehub.raceservice.race.interfaces.http.dto.KeystrokeDto;
import com.typehub.raceservice.race.interfaces.http.dto.VerifyMetricsRequest;
import com.typehub.raceservice.race.service.TypingTestService;
import com.typehub.raceservice.race.service.TypingTestService.TestResult;
import com.typehub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 单人测试 http 接口：结算、复核、最近记录
 */
@RestController
@RequestMapping("/api/typing")
@RequiredArgsConstructor
public class TypingTestController {

    private final TypingTestService typingTestService;

    /**
     * 服务端权威结算
     */
    @PostMapping("/finish")
    public ResponseEntity<ApiResponse<FinishTestResponse>> finish(@Valid @RequestBody FinishTestRequest req) {
        List<KeystrokeRecord> log = toRecords(req.getUserId(), req.getKeystrokes());
        TestResult r = typingTestService.finishTest(req.getUserId(), req.getMode(), req.getDurationSeconds(),
                req.getTargetText(), log, req.getClientRawWpm(), req.getClientAccuracy());
        FinishTestResponse body = FinishTestResponse.builder()
                .sessionId(r.record().getSessionId())
                .metrics(r.metrics())
                .clientMetricsValid(r.verification().valid())
                .verificationErrors(r.verification().errors())
                .newlyUnlocked(r.learning() == null ? List.of() : r.learning().newlyUnlocked())
                .nextToUnlock(r.learning() == null ? null : r.learning().nextToUnlock())
                .build();
        return ResponseEntity.ok(ApiResponse.success(body));
    }

    /**
     * 只复核客户端上报的指标，不落库
     */
    @PostMapping("/verify")
    public ResponseEntity<ApiResponse<VerificationResult>> verify(@Valid @RequestBody VerifyMetricsRequest req) {
        VerificationResult result = typingTestService.verify(req.getTargetText(),
                toRecords("verify", req.getKeystrokes()), req.getClientRawWpm(), req.getClientAccuracy());
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @GetMapping("/users/{userId}/sessions")
    public ResponseEntity<ApiResponse<List<TestSessionRecord>>> recent(@PathVariable String userId,
                                                                      @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiResponse.success(typingTestService.recentSessions(userId, limit)));
    }

    private static List<KeystrokeRecord> toRecords(String sessionId, List<KeystrokeDto> dtos) {
        return dtos.stream().map(d -> d.toRecord(sessionId)).toList();
    }
}
