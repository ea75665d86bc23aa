package com.typehub.raceservice.race.domain.bot;

import java.util.Map;
import java.util.Random;

/**
 * QWERTY 键盘相邻键表，用于模拟“手滑”打错。
 */
final class KeyboardNeighbors {

    private static final Map<Character, String> NEIGHBORS = Map.ofEntries(
            Map.entry('q', "wa"), Map.entry('w', "qeas"), Map.entry('e', "wrsd"),
            Map.entry('r', "etdf"), Map.entry('t', "ryfg"), Map.entry('y', "tugh"),
            Map.entry('u', "yihj"), Map.entry('i', "uojk"), Map.entry('o', "ipkl"),
            Map.entry('p', "ol"), Map.entry('a', "qwsz"), Map.entry('s', "awedxz"),
            Map.entry('d', "serfcx"), Map.entry('f', "drtgvc"), Map.entry('g', "ftyhbv"),
            Map.entry('h', "gyujnb"), Map.entry('j', "huikmn"), Map.entry('k', "jiolm"),
            Map.entry('l', "kop"), Map.entry('z', "asx"), Map.entry('x', "zsdc"),
            Map.entry('c', "xdfv"), Map.entry('v', "cfgb"), Map.entry('b', "vghn"),
            Map.entry('n', "bhjm"), Map.entry('m', "njk"), Map.entry(' ', "cvbnm"));

    private KeyboardNeighbors() {}

    static boolean hasNeighbors(char c) {
        return NEIGHBORS.containsKey(Character.toLowerCase(c));
    }

    /**
     * 随机取一个相邻键，大写字母返回大写；没有相邻键时原样返回。
     */
    static char adjacent(char c, Random random) {
        String keys = NEIGHBORS.get(Character.toLowerCase(c));
        if (keys == null) return c;
        char picked = keys.charAt(random.nextInt(keys.length()));
        return Character.isUpperCase(c) ? Character.toUpperCase(picked) : picked;
    }
}
