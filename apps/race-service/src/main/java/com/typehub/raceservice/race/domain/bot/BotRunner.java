package com.typehub.raceservice.race.domain.bot;

import com.typehub.metrics.KeystrokeRecord;
import com.typehub.metrics.LiveStats;
import com.typehub.metrics.MetricsKernel;
import com.typehub.metrics.SessionMetrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * BotRunner
 * -------------------------------------------------------
 * 机器人对手：在虚拟时间上模拟真人敲击，产生与真人同格式的按键日志，
 * 再交给 {@link MetricsKernel} 计算进度 / 速度 / 准确率。
 * -------------------------------------------------------
 * Responsibilities:
 *  - start：为本场抽取一个速度（正态分布，截断），据此校准平均按键间隔；
 *  - tick：虚拟时间前进一个 tick，执行所有到期动作（敲字 / 打错 / 退格 / 改正）；
 *  - 按键间隔服从对数正态分布，均值等于校准后的间隔；
 *  - 打错时敲相邻键，经过纠错延迟后退格再补上正确字符；最后一个字符不会打错。
 * -------------------------------------------------------
 * 非线程安全，由调用方串行驱动；给定种子时结果完全可复现。
 */
public class BotRunner {

    public static final long DEFAULT_TICK_MS = 50;

    private static final long MIN_INTERVAL_MS = 10;
    private static final int MAX_SIMULATED_TICKS = 1_000_000;

    private enum NextAction { TYPE, BACKSPACE, CORRECT }

    private final BotProfile profile;
    private final String targetText;
    private final Random random;
    private final long tickMs;
    private final String sessionId;

    private final List<KeystrokeRecord> keystrokes = new ArrayList<>();
    private final StringBuilder typed = new StringBuilder();
    private int cursorIndex;
    private boolean started;
    private long startTime;
    private long virtualNow;
    private long nextActionAt;
    private NextAction nextAction = NextAction.TYPE;
    private double baseIntervalMs;
    private double paceWpm;
    private boolean corrected;
    private BotProgress lastProgress = BotProgress.IDLE;

    public BotRunner(BotProfile profile, String targetText, Random random, long tickMs) {
        if (tickMs <= 0) throw new IllegalArgumentException("tickMs must be positive");
        this.profile = profile;
        this.targetText = targetText == null ? "" : targetText;
        this.random = random;
        this.tickMs = tickMs;
        this.sessionId = "bot-" + Integer.toHexString(System.identityHashCode(this));
    }

    public static BotRunner create(BotProfile profile, String targetText, long seed) {
        return new BotRunner(profile, targetText, new Random(seed), DEFAULT_TICK_MS);
    }

    public static BotRunner create(BotLevel level, String targetText, long seed) {
        return create(level.profile(), targetText, seed);
    }

    /**
     * 开始打字。重复调用无效。
     * @param nowMs 开始时刻（服务端时钟）
     */
    public void start(long nowMs) {
        if (started) return;
        started = true;
        startTime = nowMs;
        virtualNow = nowMs;

        double mean = profile.targetWpmMean();
        double sd = profile.targetWpmStdDev();
        double drawn = mean + random.nextGaussian() * sd;
        paceWpm = Math.max(Math.max(5, mean - 2.5 * sd), Math.min(mean + 2.5 * sd, drawn));

        // 每个字符的期望耗时 = b + p * (c + b)，令其等于 12000 / pace
        double p = profile.mistakeProbability();
        double c = profile.meanCorrectionDelayMs();
        baseIntervalMs = Math.max(MIN_INTERVAL_MS, (12000.0 / paceWpm - p * c) / (1 + p));
        nextActionAt = startTime + nextInterval();
    }

    /**
     * 前进一个 tick。未开始或已完成时不做任何事，返回最近一次进度。
     */
    public BotProgress tick() {
        if (!started || isFinished()) {
            return lastProgress;
        }
        virtualNow += tickMs;
        boolean acted = false;
        while (!isFinished() && nextActionAt <= virtualNow) {
            perform(nextActionAt);
            acted = true;
        }
        if (acted || isFinished()) {
            lastProgress = measure();
        } else {
            lastProgress = new BotProgress(lastProgress.progress(), lastProgress.wpm(),
                    lastProgress.accuracy(), virtualNow - startTime, false);
        }
        return lastProgress;
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isFinished() {
        return cursorIndex >= targetText.length();
    }

    public int cursorIndex() {
        return cursorIndex;
    }

    public String typedText() {
        return typed.toString();
    }

    public long startTime() {
        return startTime;
    }

    /** 本场抽到的速度 */
    public double paceWpm() {
        return paceWpm;
    }

    public List<KeystrokeRecord> keystrokes() {
        return Collections.unmodifiableList(keystrokes);
    }

    public BotProgress lastProgress() {
        return lastProgress;
    }

    /**
     * 当前时刻的终局口径统计（首末按键间隔计时），比赛提前结束时也用它定格机器人成绩。
     */
    public BotProgress finalProgress() {
        LiveStats s = MetricsKernel.finalRaceStats(keystrokes, typed.toString(), targetText);
        return new BotProgress(s.progress(), s.netWpm(), s.accuracy(), virtualNow - startTime, isFinished());
    }

    /**
     * 完整的会话指标（一致性、错字明细等）。
     */
    public SessionMetrics sessionMetrics() {
        return MetricsKernel.computeMetrics(keystrokes, targetText, typed.toString());
    }

    /**
     * 从 0 时刻开始把整场跑完，返回每个 tick 的进度。
     */
    public static List<BotProgress> simulateFullRace(BotLevel level, String text, long seed) {
        BotRunner runner = create(level, text, seed);
        List<BotProgress> updates = new ArrayList<>();
        runner.start(0);
        int guard = 0;
        while (!runner.isFinished() && guard++ < MAX_SIMULATED_TICKS) {
            updates.add(runner.tick());
        }
        return updates;
    }

    // ---------------------------------------------------------------------

    private void perform(long at) {
        char expected = targetText.charAt(cursorIndex);
        switch (nextAction) {
            case TYPE -> {
                boolean canMiss = cursorIndex < targetText.length() - 1 && KeyboardNeighbors.hasNeighbors(expected);
                if (canMiss && random.nextDouble() < profile.mistakeProbability()) {
                    char wrong = KeyboardNeighbors.adjacent(expected, random);
                    typed.append(wrong);
                    keystrokes.add(KeystrokeRecord.keydown(sessionId, expected, wrong, at, cursorIndex));
                    nextAction = NextAction.BACKSPACE;
                    nextActionAt = at + correctionDelay();
                } else {
                    commit(expected, at);
                }
            }
            case BACKSPACE -> {
                typed.setLength(typed.length() - 1);
                keystrokes.add(KeystrokeRecord.backspace(sessionId, expected, at, cursorIndex + 1));
                corrected = true;
                nextAction = NextAction.CORRECT;
                nextActionAt = at + nextInterval();
            }
            case CORRECT -> commit(expected, at);
        }
    }

    private void commit(char expected, long at) {
        typed.append(expected);
        keystrokes.add(KeystrokeRecord.keydown(sessionId, expected, expected, at, cursorIndex));
        cursorIndex++;
        nextAction = NextAction.TYPE;
        nextActionAt = at + nextInterval();
    }

    private BotProgress measure() {
        if (isFinished()) {
            return finalProgress();
        }
        LiveStats s = MetricsKernel.liveStats(typed.toString(), targetText, virtualNow - startTime, corrected);
        return new BotProgress(s.progress(), s.netWpm(), s.accuracy(), virtualNow - startTime, false);
    }

    /** 对数正态：mu = ln(b) - sigma^2 / 2，使均值为 b */
    private long nextInterval() {
        double sigma = profile.sigma();
        double mu = Math.log(baseIntervalMs) - sigma * sigma / 2;
        double v = Math.exp(mu + sigma * random.nextGaussian());
        return Math.max(1, Math.round(v));
    }

    private long correctionDelay() {
        long min = profile.correctionDelayMinMs();
        long span = profile.correctionDelayMaxMs() - min;
        return min + Math.round(random.nextDouble() * span);
    }
}
