package com.typehub.metrics;

/** 按键事件类型：普通字符键 / 退格键 */
public enum KeystrokeKind {
    KEYDOWN,
    BACKSPACE
}
