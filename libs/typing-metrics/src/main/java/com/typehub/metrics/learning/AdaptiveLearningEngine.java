package com.typehub.metrics.learning;

import com.typehub.metrics.WordBank;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * AdaptiveLearningEngine
 * -------------------------------------------------------
 * 逐字母自适应练习：累计熟练度、按频率逐个解锁字母、挑出薄弱字母生成课文。
 * -------------------------------------------------------
 * Responsibilities:
 *  - update：把一次练习的样本按 0.7/0.3 平滑进历史统计并判断解锁；
 *  - 查询已解锁 / 未解锁 / 薄弱字母，以及下一个待解锁字母；
 *  - 生成只包含已解锁字母的练习课文（70% 词含薄弱字母）。
 * -------------------------------------------------------
 * 持久化由注入的 {@link CharacterStatsRepository} 负责，本类不持有任何跨用户状态。
 */
@Slf4j
public class AdaptiveLearningEngine {

    /** 初始即解锁的字母 */
    public static final Set<Character> STARTING_LETTERS = Set.of('e', 't', 'a', 'o', 'i', 'n', 's', 'r');
    /** 解锁顺序（英文字母频率） */
    public static final String FREQUENCY_ORDER = "etaoinshrdlcumwfgypbvkjxqz";

    private static final double FOCUS_SHARE = 0.7;

    private final CharacterStatsRepository repository;
    private final double targetWpm;

    public AdaptiveLearningEngine(CharacterStatsRepository repository) {
        this(repository, ConfidenceMath.TARGET_WPM);
    }

    public AdaptiveLearningEngine(CharacterStatsRepository repository, double targetWpm) {
        this.repository = repository;
        this.targetWpm = targetWpm;
    }

    /**
     * 合并一次练习的样本。
     * @param userId  用户ID
     * @param samples 字母 -> 本次样本
     * @return 更新后的字母、新解锁字母、下一个待解锁字母
     */
    public LearningUpdate update(String userId, Map<Character, CharacterSample> samples) {
        Map<Character, CharacterConfidence> saved = new HashMap<>(repository.findAll(userId));
        Map<Character, CharacterConfidence> changed = new HashMap<>();
        List<CharacterConfidence> updated = new ArrayList<>();
        List<Character> newlyUnlocked = new ArrayList<>();

        for (CharacterSample sample : samples.values()) {
            char c = sample.character();
            CharacterConfidence prev = saved.get(c);
            boolean wasUnlocked = isUnlocked(c, prev);
            CharacterConfidence next = merge(c, prev, sample);
            if (!wasUnlocked && next.isUnlocked()) {
                newlyUnlocked.add(c);
            }
            saved.put(c, next);
            changed.put(c, next);
            updated.add(next);
        }

        repository.saveAll(userId, changed);
        if (!newlyUnlocked.isEmpty()) {
            log.info("用户解锁新字母: userId={}, letters={}", userId, newlyUnlocked);
        }
        return new LearningUpdate(updated, newlyUnlocked, nextToUnlock(saved));
    }

    /** 已解锁字母（含初始字母），按字母序 */
    public List<Character> unlockedLetters(String userId) {
        return new ArrayList<>(unlockedSet(repository.findAll(userId)));
    }

    public List<Character> lockedLetters(String userId) {
        Set<Character> unlocked = unlockedSet(repository.findAll(userId));
        List<Character> locked = new ArrayList<>();
        for (char c = 'a'; c <= 'z'; c++) {
            if (!unlocked.contains(c)) locked.add(c);
        }
        return locked;
    }

    /**
     * 已解锁字母中熟练度最低的若干个；有数据的排在无数据的前面。
     */
    public List<Character> weakLetters(String userId, int count) {
        Map<Character, CharacterConfidence> data = repository.findAll(userId);
        List<Character> unlocked = new ArrayList<>(unlockedSet(data));
        unlocked.sort(Comparator
                .comparing((Character c) -> !data.containsKey(c))
                .thenComparingDouble(c -> data.containsKey(c) ? data.get(c).getConfidence() : 0));
        return unlocked.subList(0, Math.min(count, unlocked.size()));
    }

    /** 26 个字母的完整视图，没有数据的字母返回零值 */
    public List<CharacterConfidence> allStats(String userId) {
        Map<Character, CharacterConfidence> data = repository.findAll(userId);
        List<CharacterConfidence> all = new ArrayList<>(26);
        for (char c = 'a'; c <= 'z'; c++) {
            CharacterConfidence existing = data.get(c);
            if (existing != null) {
                all.add(existing);
            } else {
                boolean unlocked = STARTING_LETTERS.contains(c);
                all.add(CharacterConfidence.builder()
                        .character(c)
                        .unlocked(unlocked)
                        .status(ConfidenceStatus.of(0, unlocked))
                        .build());
            }
        }
        return all;
    }

    public Character nextToUnlock(String userId) {
        return nextToUnlock(repository.findAll(userId));
    }

    public void reset(String userId) {
        repository.deleteAll(userId);
        log.info("用户学习进度已重置: userId={}", userId);
    }

    /**
     * 生成练习课文：只使用已解锁字母组成的单词，约 70% 的词包含薄弱字母。
     * 可用单词不足 10 个时，用已解锁字母拼出 2~4 字母的伪词。
     */
    public Lesson lesson(String userId, int wordCount, Random random) {
        List<Character> unlocked = unlockedLetters(userId);
        List<Character> focus = weakLetters(userId, 3);
        if (focus.isEmpty()) {
            focus = unlocked.subList(0, Math.min(3, unlocked.size()));
        }
        Set<Character> unlockedSet = new TreeSet<>(unlocked);

        List<String> bank = new ArrayList<>();
        for (String w : WordBank.words()) {
            if (onlyUses(w, unlockedSet)) bank.add(w);
        }
        if (bank.size() < 10) {
            bank = pseudoWords(unlocked, 50, List.of(), random);
        }

        List<String> focusWords = new ArrayList<>();
        List<String> otherWords = new ArrayList<>();
        for (String w : bank) {
            if (containsAny(w, focus)) focusWords.add(w); else otherWords.add(w);
        }
        int focusCount = (int) Math.ceil(wordCount * FOCUS_SHARE);
        if (focusWords.size() < focusCount) {
            focusWords.addAll(pseudoWords(unlocked, (focusCount - focusWords.size()) * 2, focus, random));
        }

        List<String> picked = new ArrayList<>(wordCount);
        for (int i = 0; i < focusCount; i++) {
            picked.add(focusWords.get(random.nextInt(focusWords.size())));
        }
        List<String> otherSource = otherWords.isEmpty() ? bank : otherWords;
        while (picked.size() < wordCount) {
            picked.add(otherSource.get(random.nextInt(otherSource.size())));
        }
        Collections.shuffle(picked, random);

        return new Lesson(String.join(" ", picked.subList(0, wordCount)), unlocked, focus, lockedLetters(userId));
    }

    // ---------------------------------------------------------------------

    private CharacterConfidence merge(char c, CharacterConfidence prev, CharacterSample s) {
        double wpm = s.wpm();
        double accuracy = s.accuracy();
        int occurrences = s.occurrences();
        double avg = s.avgTimeMs();
        double std = s.stdDev();
        if (prev != null) {
            wpm = ConfidenceMath.smooth(prev.getWpm(), wpm);
            accuracy = ConfidenceMath.smooth(prev.getAccuracy(), accuracy);
            occurrences += prev.getOccurrences();
            avg = ConfidenceMath.smooth(prev.getAvgTimeMs(), avg);
            std = ConfidenceMath.smooth(prev.getStdDev(), std);
        }
        CharacterConfidence next = CharacterConfidence.builder()
                .character(c)
                .confidence(ConfidenceMath.confidence(wpm, accuracy, std, targetWpm))
                .wpm(Math.round(wpm * 10) / 10d)
                .accuracy(Math.round(accuracy * 10) / 10d)
                .occurrences(occurrences)
                .avgTimeMs(Math.round(avg))
                .stdDev(Math.round(std))
                .unlocked(isUnlocked(c, prev))
                .build();
        if (!next.isUnlocked() && ConfidenceMath.shouldUnlock(next, targetWpm)) {
            next.setUnlocked(true);
        }
        next.setStatus(ConfidenceStatus.of(next.getConfidence(), next.isUnlocked()));
        return next;
    }

    private static boolean isUnlocked(char c, CharacterConfidence stats) {
        return STARTING_LETTERS.contains(c) || (stats != null && stats.isUnlocked());
    }

    private static Set<Character> unlockedSet(Map<Character, CharacterConfidence> data) {
        Set<Character> unlocked = new TreeSet<>(STARTING_LETTERS);
        data.forEach((c, s) -> {
            if (s.isUnlocked()) unlocked.add(c);
        });
        return unlocked;
    }

    private static Character nextToUnlock(Map<Character, CharacterConfidence> data) {
        for (char c : FREQUENCY_ORDER.toCharArray()) {
            if (!isUnlocked(c, data.get(c))) return c;
        }
        return null;
    }

    private static boolean onlyUses(String word, Set<Character> letters) {
        for (char c : word.toLowerCase().toCharArray()) {
            if (c >= 'a' && c <= 'z' && !letters.contains(c)) return false;
        }
        return true;
    }

    private static boolean containsAny(String word, List<Character> letters) {
        for (char c : letters) {
            if (word.indexOf(c) >= 0) return true;
        }
        return false;
    }

    private static List<String> pseudoWords(List<Character> letters, int count, List<Character> focus, Random random) {
        List<String> words = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int len = 2 + random.nextInt(3);
            int focusPos = focus.isEmpty() ? -1 : random.nextInt(len);
            StringBuilder sb = new StringBuilder(len);
            for (int j = 0; j < len; j++) {
                if (j == focusPos) {
                    sb.append(focus.get(random.nextInt(focus.size())));
                } else {
                    sb.append(letters.get(random.nextInt(letters.size())));
                }
            }
            words.add(sb.toString());
        }
        return words;
    }

    /** 一次合并的结果 */
    public record LearningUpdate(List<CharacterConfidence> updated,
                                 List<Character> newlyUnlocked,
                                 Character nextToUnlock) {
    }

    /** 练习课文 */
    public record Lesson(String text,
                         List<Character> availableLetters,
                         List<Character> focusLetters,
                         List<Character> lockedLetters) {
    }
}
