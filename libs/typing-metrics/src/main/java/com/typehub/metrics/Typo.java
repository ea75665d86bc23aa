package com.typehub.metrics;

/** 单个错字：目标文本位置、期望字符、实际字符 */
public record Typo(int position, char expected, char typed) {
}
