package com.typehub.raceservice.race.domain.rule;

import com.typehub.raceservice.race.domain.model.RaceState;

/**
 * 状态机一次操作的结果。
 * applied=false 为幂等空操作：state 原样返回，version 不变。
 */
public record Transition(RaceState state, boolean applied) {

    public static Transition applied(RaceState state) {
        return new Transition(state, true);
    }

    public static Transition noop(RaceState state) {
        return new Transition(state, false);
    }
}
