package com.typehub.raceservice.race.service;

import com.typehub.raceservice.race.domain.bot.BotLevel;
import com.typehub.raceservice.race.domain.bot.BotProgress;
import com.typehub.raceservice.race.domain.model.RaceState;

import java.util.List;

/**
 * 比赛业务服务接口：建房、加入、倒计时、开赛、输入、取消。
 */
public interface RaceService {

    /**
     * 创建真人对战房间。
     * @param durationSeconds 比赛时长，为 null 时取默认配置
     */
    RaceState createRace(String hostId, Integer durationSeconds);

    /**
     * 创建人机对战房间（机器人立即入座）。
     */
    RaceState createBotRace(String hostId, BotLevel level, Integer durationSeconds);

    /**
     * 按房间号加入；房主或已入座的对手重复加入直接返回当前状态。
     */
    RaceState joinRace(String roomCode, String userId);

    /**
     * 查询比赛；进行中时返回本节点协调器的实时视图。
     */
    RaceState getRace(String roomCode);

    /**
     * 房主开始倒计时（重复调用幂等）。
     */
    RaceState startCountdown(String roomCode, String requesterId);

    /**
     * 倒计时到期回调：COUNTDOWN → ACTIVE 并启动协调器。
     */
    void onCountdownElapsed(String roomCode);

    /**
     * 参赛者取消比赛。
     */
    RaceState cancelRace(String roomCode, String requesterId);

    /**
     * 参赛者提交当前完整输入。
     * @return 该参赛者协调器的最新视图
     */
    RaceState submitInput(String roomCode, String participantId, String typedText);

    /**
     * 离线模拟一整场机器人比赛（调试与调参用）。
     */
    List<BotProgress> simulateBot(BotLevel level, String text, long seed);
}
