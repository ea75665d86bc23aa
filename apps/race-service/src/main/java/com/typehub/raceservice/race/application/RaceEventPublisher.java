package com.typehub.raceservice.race.application;

import com.typehub.raceservice.race.interfaces.ws.dto.RaceWsMessages.BroadcastEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 房间广播：统一拼装主题 /topic/race.{roomCode}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RaceEventPublisher {

    private final SimpMessagingTemplate messaging;

    public void send(String roomCode, String raceId, String type, Object payload) {
        try {
            messaging.convertAndSend(topic(roomCode), BroadcastEvent.of(roomCode, raceId, type, payload));
        } catch (MessagingException e) {
            log.warn("房间广播失败: roomCode={}, type={}, err={}", roomCode, type, e.getMessage());
        }
    }

    public static String topic(String roomCode) {
        return "/topic/race." + roomCode;
    }
}
