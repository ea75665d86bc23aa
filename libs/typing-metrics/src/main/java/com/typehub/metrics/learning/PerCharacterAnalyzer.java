package com.typehub.metrics.learning;

import com.typehub.metrics.KeystrokeRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 从按键日志中提取逐字母样本。
 * <p>
 * 按键间隔取"与上一个正确按键的时间差"，只统计 (0, 5000) 毫秒内的间隔；
 * 非字母字符不产生样本，但正确输入时仍然推进间隔链。退格不参与统计。
 */
public final class PerCharacterAnalyzer {

    static final long MAX_LATENCY_MS = 5_000L;
    static final double DEFAULT_AVG_TIME_MS = 500;

    private PerCharacterAnalyzer() {
    }

    public static Map<Character, CharacterSample> analyze(List<KeystrokeRecord> log) {
        Map<Character, Acc> perChar = new TreeMap<>();
        Long prevCorrectTs = null;

        for (KeystrokeRecord k : log) {
            if (k.isBackspace()) continue;
            char expected = Character.toLowerCase(k.expectedChar());
            boolean correct = k.isCorrect();

            if (expected < 'a' || expected > 'z') {
                if (correct) prevCorrectTs = k.timestampMs();
                continue;
            }

            Acc acc = perChar.computeIfAbsent(expected, c -> new Acc());
            acc.total++;
            if (correct) {
                acc.correct++;
                if (prevCorrectTs != null) {
                    long latency = k.timestampMs() - prevCorrectTs;
                    if (latency > 0 && latency < MAX_LATENCY_MS) acc.latencies.add(latency);
                }
                prevCorrectTs = k.timestampMs();
            }
        }

        Map<Character, CharacterSample> out = new TreeMap<>();
        perChar.forEach((c, acc) -> out.put(c, acc.toSample(c)));
        return out;
    }

    private static final class Acc {
        int total;
        int correct;
        final List<Long> latencies = new ArrayList<>();

        CharacterSample toSample(char c) {
            double accuracy = total > 0 ? correct * 100d / total : 0;
            double avg = DEFAULT_AVG_TIME_MS;
            double std = 0;
            if (!latencies.isEmpty()) {
                double sum = 0;
                for (long l : latencies) sum += l;
                avg = sum / latencies.size();
                double sq = 0;
                for (long l : latencies) sq += (l - avg) * (l - avg);
                std = Math.sqrt(sq / latencies.size());
            }
            double wpm = avg > 0 ? (60_000d / avg) / 5 : 0;
            return new CharacterSample(c, wpm, accuracy, total, avg, std);
        }
    }
}
