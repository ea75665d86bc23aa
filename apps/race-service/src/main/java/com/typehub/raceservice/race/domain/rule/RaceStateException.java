package com.typehub.raceservice.race.domain.rule;

/**
 * 状态机拒绝的迁移（InvalidState）。对外映射为 HTTP 409 / STOMP ERROR 事件。
 */
public class RaceStateException extends IllegalStateException {

    public RaceStateException(String message) {
        super(message);
    }
}
