package com.typehub.metrics;

import java.util.Objects;

/**
 * 一次按键记录（按时间戳有序追加，只增不改）。
 * <p>
 * 只能通过 {@link #keydown} / {@link #backspace} 两个工厂方法创建：
 * <ul>
 *   <li>KEYDOWN：typedChar 为实际输入字符，是否正确由 typedChar == expectedChar 推导；</li>
 *   <li>BACKSPACE：typedChar 固定为 {@link #NO_CHAR}，永远不算正确。</li>
 * </ul>
 * 光标越过目标文本时 expectedChar 为 {@link #NO_CHAR}。
 *
 * @param sessionId    所属会话（测试会话 ID 或 raceId:participantId）
 * @param expectedChar 光标处期望字符
 * @param typedChar    实际输入字符
 * @param timestampMs  时间戳（毫秒，只比较差值）
 * @param cursorIndex  按键发生时的光标位置
 * @param kind         事件类型
 */
public record KeystrokeRecord(String sessionId,
                              char expectedChar,
                              char typedChar,
                              long timestampMs,
                              int cursorIndex,
                              KeystrokeKind kind) {

    /** 占位字符：退格或光标越界时使用 */
    public static final char NO_CHAR = '\0';

    public KeystrokeRecord {
        Objects.requireNonNull(kind, "kind");
        if (cursorIndex < 0) {
            throw new IllegalArgumentException("cursorIndex must be >= 0: " + cursorIndex);
        }
    }

    public static KeystrokeRecord keydown(String sessionId, char expectedChar, char typedChar,
                                          long timestampMs, int cursorIndex) {
        return new KeystrokeRecord(sessionId, expectedChar, typedChar, timestampMs, cursorIndex, KeystrokeKind.KEYDOWN);
    }

    public static KeystrokeRecord backspace(String sessionId, char expectedChar, long timestampMs, int cursorIndex) {
        return new KeystrokeRecord(sessionId, expectedChar, NO_CHAR, timestampMs, cursorIndex, KeystrokeKind.BACKSPACE);
    }

    public boolean isBackspace() {
        return kind == KeystrokeKind.BACKSPACE;
    }

    /** 仅 KEYDOWN 且输入与期望一致时为 true */
    public boolean isCorrect() {
        return kind == KeystrokeKind.KEYDOWN && expectedChar != NO_CHAR && typedChar == expectedChar;
    }
}
