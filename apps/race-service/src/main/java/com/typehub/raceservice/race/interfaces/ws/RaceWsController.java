package com.typehub.raceservice.race.interfaces.ws;

import com.typehub.raceservice.race.application.RaceEventPublisher;
import com.typehub.raceservice.race.interfaces.ws.dto.RaceWsMessages;
import com.typehub.raceservice.race.interfaces.ws.dto.RaceWsMessages.InputCmd;
import com.typehub.raceservice.race.interfaces.ws.dto.RaceWsMessages.SimpleCmd;
import com.typehub.raceservice.race.service.RaceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;

import java.util.Map;

/**
 * 比赛 WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/race.* 指令；进度、结束等事件由协调器回调统一广播，
 * 这里只在出错时向房间推送 ERROR。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class RaceWsController {

    private final RaceService raceService;
    private final RaceEventPublisher events;

    /**
     * 输入变化：/app/race.input
     */
    @MessageMapping("/race.input")
    public void input(InputCmd cmd) {
        try {
            raceService.submitInput(cmd.getRoomCode(), cmd.getParticipantId(), cmd.getTypedText());
        } catch (IllegalArgumentException | IllegalStateException e) {
            sendError(cmd.getRoomCode(), cmd.getParticipantId(), e.getMessage());
        }
    }

    /**
     * 取消：/app/race.cancel
     */
    @MessageMapping("/race.cancel")
    public void cancel(SimpleCmd cmd) {
        try {
            raceService.cancelRace(cmd.getRoomCode(), cmd.getParticipantId());
        } catch (IllegalArgumentException | IllegalStateException e) {
            sendError(cmd.getRoomCode(), cmd.getParticipantId(), e.getMessage());
        }
    }

    private void sendError(String roomCode, String participantId, String message) {
        log.debug("WS 指令失败: roomCode={}, participant={}, err={}", roomCode, participantId, message);
        if (roomCode == null) return;
        events.send(roomCode, null, RaceWsMessages.ERROR, Map.of(
                "participantId", participantId == null ? "" : participantId,
                "message", message == null ? "" : message));
    }
}
