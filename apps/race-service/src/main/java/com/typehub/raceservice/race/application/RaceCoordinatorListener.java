package com.typehub.raceservice.race.application;

import com.typehub.raceservice.race.domain.model.PlayerState;
import com.typehub.raceservice.race.domain.model.RaceState;

/**
 * 协调器对外回调（广播、落库由实现方负责）。
 */
public interface RaceCoordinatorListener {

    /**
     * 某个参赛者的进度发生变化。
     * @param view        协调器当前视图
     * @param participant 变化后的参赛者
     * @param local       true 表示由本协调器驱动（本地输入或机器人），false 表示合并自对手快照
     */
    default void onProgress(RaceState view, PlayerState participant, boolean local) {}

    /** 比赛结束（已判定胜负） */
    default void onFinished(RaceState finalState) {}

    /** 比赛被取消 */
    default void onCancelled(RaceState state) {}

    RaceCoordinatorListener NOOP = new RaceCoordinatorListener() {};
}
