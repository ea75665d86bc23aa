package com.typehub.raceservice.race.domain.model;

import com.typehub.raceservice.race.domain.bot.BotLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个参赛者的实时状态。
 * wpm 为净速（只计正确字符），progress / accuracy 均为百分比。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlayerState {
    /** 参赛者ID（机器人为 BOT_{LEVEL}） */
    private String id;
    /** 进度 0~100 */
    private double progress;
    /** 净速 0~500 */
    private double wpm;
    /** 准确率 0~100 */
    @Builder.Default
    private double accuracy = 100;
    private boolean bot;
    /** 仅机器人有值 */
    private BotLevel botLevel;
    /** 首次达到 100% 的服务端时间，未完成为 null */
    private Long finishedAt;

    public static PlayerState fresh(String id) {
        return PlayerState.builder().id(id).build();
    }

    public static PlayerState bot(String id, BotLevel level) {
        return PlayerState.builder().id(id).bot(true).botLevel(level).build();
    }
}
