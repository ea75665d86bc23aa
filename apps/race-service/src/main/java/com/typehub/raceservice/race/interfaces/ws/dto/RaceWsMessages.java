package com.typehub.raceservice.race.interfaces.ws.dto;

import lombok.Data;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 *   1. 前端 -> 后端：输入、取消指令（/app/race.*）
 *   2. 后端 -> 前端：房间广播事件（/topic/race.{roomCode}）
 */
public class RaceWsMessages {

    /** 广播事件类型 */
    public static final String STATE = "STATE";
    public static final String COUNTDOWN = "COUNTDOWN";
    public static final String PROGRESS = "PROGRESS";
    public static final String FINISHED = "FINISHED";
    public static final String ERROR = "ERROR";

    /**
     * 输入指令（客户端 → 服务端）
     * 字段：
     *   - roomCode      ：房间号；
     *   - participantId ：参赛者ID；
     *   - typedText     ：当前完整输入（服务端自行与上一次比较得出按键）。
     */
    @Data
    public static class InputCmd {
        private String roomCode;
        private String participantId;
        private String typedText;
    }

    /**
     * 简单指令（取消等）
     */
    @Data
    public static class SimpleCmd {
        private String roomCode;
        private String participantId;
    }

    /**
     * 广播事件（服务端 → 客户端）
     *   - type   ：STATE / COUNTDOWN / PROGRESS / FINISHED / ERROR；
     *   - payload：比赛状态、倒计时、参赛者进度或错误信息。
     */
    @Data
    public static class BroadcastEvent {
        private String roomCode;
        private String raceId;
        private String type;
        private Object payload;

        public static BroadcastEvent of(String roomCode, String raceId, String type, Object payload) {
            BroadcastEvent e = new BroadcastEvent();
            e.setRoomCode(roomCode);
            e.setRaceId(raceId);
            e.setType(type);
            e.setPayload(payload);
            return e;
        }
    }
}
