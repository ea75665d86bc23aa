package com.typehub.raceservice.race.domain.rule;

import com.typehub.raceservice.race.domain.model.PlayerState;

/**
 * 胜负判定（纯函数）。依次比较，前一项分出胜负即返回：
 * <ol>
 *   <li>完成度：只有一方达到 95% 时该方获胜；</li>
 *   <li>净速：差值超过 0.1 时高者获胜；</li>
 *   <li>准确率：差值超过 0.01 时高者获胜；</li>
 *   <li>完成时间：都完成则早者获胜，只有一方完成则该方获胜；</li>
 *   <li>以上都相同：平局。</li>
 * </ol>
 */
public final class WinnerJudge {

    public static final double COMPLETION_THRESHOLD = 95.0;
    public static final double WPM_EPSILON = 0.1;
    public static final double ACCURACY_EPSILON = 0.01;

    private WinnerJudge() {}

    public static RaceOutcome judge(PlayerState host, PlayerState opponent) {
        if (opponent == null) {
            return RaceOutcome.win(host.getId());
        }

        boolean hostDone = host.getProgress() >= COMPLETION_THRESHOLD;
        boolean oppDone = opponent.getProgress() >= COMPLETION_THRESHOLD;
        if (hostDone != oppDone) {
            return RaceOutcome.win(hostDone ? host.getId() : opponent.getId());
        }

        double wpmGap = host.getWpm() - opponent.getWpm();
        if (Math.abs(wpmGap) > WPM_EPSILON) {
            return RaceOutcome.win(wpmGap > 0 ? host.getId() : opponent.getId());
        }

        double accGap = host.getAccuracy() - opponent.getAccuracy();
        if (Math.abs(accGap) > ACCURACY_EPSILON) {
            return RaceOutcome.win(accGap > 0 ? host.getId() : opponent.getId());
        }

        Long hf = host.getFinishedAt();
        Long of = opponent.getFinishedAt();
        if (hf != null && of != null && !hf.equals(of)) {
            return RaceOutcome.win(hf < of ? host.getId() : opponent.getId());
        }
        if (hf != null && of == null) return RaceOutcome.win(host.getId());
        if (hf == null && of != null) return RaceOutcome.win(opponent.getId());

        return RaceOutcome.draw();
    }
}
