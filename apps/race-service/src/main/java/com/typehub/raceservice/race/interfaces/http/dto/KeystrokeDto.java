package com.typehub.raceservice.race.interfaces.http.dto;

import com.typehub.metrics.KeystrokeRecord;
import com.typehub.metrics.MetricsKernel;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.List;

/**
 * 客户端上报的单个按键。字符以字符串传输，取首字符；空串表示无字符。
 */
@Data
public class KeystrokeDto {
    private String typed;
    private String expected;
    @PositiveOrZero
    private long timestamp;
    @PositiveOrZero
    private int cursorIndex;
    private boolean backspace;

    public KeystrokeRecord toRecord(String sessionId) {
        char exp = firstChar(expected);
        if (backspace) {
            return KeystrokeRecord.backspace(sessionId, exp, timestamp, cursorIndex);
        }
        return KeystrokeRecord.keydown(sessionId, exp, firstChar(typed), timestamp, cursorIndex);
    }

    /**
     * 按键日志的时间跨度（最大时间戳 - 最小时间戳）不超过单次会话上限。空日志视为合法。
     */
    public static boolean spanWithinLimit(List<KeystrokeDto> keystrokes) {
        if (keystrokes == null) return true;
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (KeystrokeDto k : keystrokes) {
            if (k == null) continue;
            min = Math.min(min, k.getTimestamp());
            max = Math.max(max, k.getTimestamp());
        }
        return min > max || max - min <= MetricsKernel.MAX_SESSION_MS;
    }

    private static char firstChar(String s) {
        return (s == null || s.isEmpty()) ? KeystrokeRecord.NO_CHAR : s.charAt(0);
    }
}
