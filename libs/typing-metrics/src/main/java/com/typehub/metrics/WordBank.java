package com.typehub.metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 常用英文单词词库（比赛文本与练习课文的素材）。
 */
public final class WordBank {

    /** 每分钟按 100 个词估算文本长度 */
    public static final int WORDS_PER_MINUTE_OF_TEXT = 100;

    private static final List<String> WORDS = List.of(
            "the", "be", "to", "of", "and", "a", "in", "that", "have", "it",
            "for", "not", "on", "with", "he", "as", "you", "do", "at", "this",
            "but", "his", "by", "from", "they", "we", "say", "her", "she", "or",
            "an", "will", "my", "one", "all", "would", "there", "their", "what", "so",
            "up", "out", "if", "about", "who", "get", "which", "go", "me", "when",
            "make", "can", "like", "time", "no", "just", "him", "know", "take", "into",
            "year", "your", "good", "some", "them", "see", "other", "than", "then", "now",
            "look", "only", "come", "its", "over", "think", "also", "back", "after", "use",
            "two", "how", "our", "work", "first", "well", "way", "even", "new", "want",
            "day", "most", "us", "is", "are", "was", "were", "been", "has", "had",
            "state", "never", "before", "high", "every", "same", "under", "last", "great", "own",
            "little", "still", "world", "life", "home", "read", "hand", "between", "each", "made",
            "next", "sound", "below", "saw", "house", "again", "side", "large", "three", "small",
            "part", "live", "found", "upon", "right", "left", "line", "turn", "move", "must",
            "name", "kind", "need", "place", "long", "old", "help", "mean", "might", "end",
            "different", "around", "animal", "point", "mother", "answer", "learn", "study", "father", "head",
            "stand", "page", "earth", "letter", "thought", "together", "until", "children", "begin", "idea",
            "enough", "almost", "above", "sometimes", "mountain", "paper", "example", "hundred", "thousand", "second");

    private WordBank() {
    }

    public static List<String> words() {
        return WORDS;
    }

    /** 根据时长估算需要的单词数：ceil(seconds / 60 * 100)，至少 1 个 */
    public static int wordCountFor(int durationSeconds) {
        return Math.max(1, (int) Math.ceil(durationSeconds / 60d * WORDS_PER_MINUTE_OF_TEXT));
    }

    /** 随机抽取 count 个单词，以单个空格连接 */
    public static String randomText(int count, Random random) {
        List<String> picked = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            picked.add(WORDS.get(random.nextInt(WORDS.size())));
        }
        return String.join(" ", picked);
    }
}
