package com.typehub.raceservice.race.interfaces.http;

import com.typehub.raceservice.race.domain.bot.BotLevel;
import com.typehub.raceservice.race.domain.bot.BotProgress;
import com.typehub.raceservice.race.domain.model.RaceState;
import com.typehub.raceservice.race.interfaces.http.dto.CreateRaceRequest;
import com.typehub.raceservice.race.interfaces.http.dto.ParticipantRequest;
import com.typehub.raceservice.race.interfaces.http.dto.SimulateBotRequest;
import com.typehub.raceservice.race.service.RaceService;
import com.typehub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.SecureRandom;
import java.util.List;

/**
 * 比赛 http 接口
 */
@RestController
@RequestMapping("/api/race")
@RequiredArgsConstructor
public class RaceRestController {

    private final RaceService raceService;

    /**
     * 建房：level 为空为真人对战，否则机器人立即入座。
     */
    @PostMapping("/rooms")
    public ResponseEntity<ApiResponse<RaceState>> create(@Valid @RequestBody CreateRaceRequest req) {
        RaceState state = StringUtils.isBlank(req.getLevel())
                ? raceService.createRace(req.getHostId(), req.getDurationSeconds())
                : raceService.createBotRace(req.getHostId(), BotLevel.parse(req.getLevel()), req.getDurationSeconds());
        return ResponseEntity.ok(ApiResponse.success(state));
    }

    /**
     * 按房间号加入
     */
    @PostMapping("/rooms/{roomCode}/join")
    public ResponseEntity<ApiResponse<RaceState>> join(@PathVariable String roomCode,
                                                       @Valid @RequestBody ParticipantRequest req) {
        return ResponseEntity.ok(ApiResponse.success(raceService.joinRace(roomCode, req.getParticipantId())));
    }

    /**
     * 查看比赛（进行中返回实时视图）
     */
    @GetMapping("/rooms/{roomCode}")
    public ResponseEntity<ApiResponse<RaceState>> view(@PathVariable String roomCode) {
        return ResponseEntity.ok(ApiResponse.success(raceService.getRace(roomCode)));
    }

    /**
     * 房主开始倒计时
     */
    @PostMapping("/rooms/{roomCode}/start")
    public ResponseEntity<ApiResponse<RaceState>> start(@PathVariable String roomCode,
                                                        @Valid @RequestBody ParticipantRequest req) {
        return ResponseEntity.ok(ApiResponse.success(raceService.startCountdown(roomCode, req.getParticipantId())));
    }

    /**
     * 提交当前输入（WebSocket 不可用时的备用通道）
     */
    @PostMapping("/rooms/{roomCode}/input")
    public ResponseEntity<ApiResponse<RaceState>> input(@PathVariable String roomCode,
                                                        @Valid @RequestBody ParticipantRequest req) {
        return ResponseEntity.ok(ApiResponse.success(
                raceService.submitInput(roomCode, req.getParticipantId(), req.getTypedText())));
    }

    /**
     * 取消比赛
     */
    @PostMapping("/rooms/{roomCode}/cancel")
    public ResponseEntity<ApiResponse<RaceState>> cancel(@PathVariable String roomCode,
                                                         @Valid @RequestBody ParticipantRequest req) {
        return ResponseEntity.ok(ApiResponse.success(raceService.cancelRace(roomCode, req.getParticipantId())));
    }

    /**
     * 离线模拟一整场机器人比赛，返回每个 tick 的进度
     */
    @PostMapping("/bots/simulate")
    public ResponseEntity<ApiResponse<List<BotProgress>>> simulate(@Valid @RequestBody SimulateBotRequest req) {
        long seed = req.getSeed() != null ? req.getSeed() : new SecureRandom().nextLong();
        return ResponseEntity.ok(ApiResponse.success(
                raceService.simulateBot(BotLevel.parse(req.getLevel()), req.getText(), seed)));
    }
}
