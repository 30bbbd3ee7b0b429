package org.calista.grila.crossword.theme;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.dictionary.Difficulty;
import org.calista.grila.crossword.dictionary.WordNormalizer;

import java.util.*;

/**
 * ThemeWordMerger — primary provider first, then fallbacks until {@code target} words are collected.
 *
 * <p>Provider failures are logged and skipped. Words are deduplicated by normalized surface;
 * the first occurrence wins, with its clue and source.</p>
 */
public final class ThemeWordMerger {

    private static final Logger log = LogManager.getLogger(ThemeWordMerger.class);

    private final ThemeWordProvider primary;
    private final List<ThemeWordProvider> fallbacks;
    private final WordNormalizer normalizer;

    /**
     * @param primary nullable
     */
    public ThemeWordMerger(ThemeWordProvider primary, List<ThemeWordProvider> fallbacks, WordNormalizer normalizer) {
        this.primary = primary;
        this.fallbacks = List.copyOf(fallbacks == null ? List.of() : fallbacks);
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    /**
     * Merger over {@link ThemeWordProvider#forAttempt(long)} instances; attempts never share provider state.
     */
    public ThemeWordMerger forAttempt(long attemptSeed) {
        List<ThemeWordProvider> fb = new ArrayList<>(fallbacks.size());
        for (ThemeWordProvider p : fallbacks) fb.add(p.forAttempt(attemptSeed));
        return new ThemeWordMerger(primary == null ? null : primary.forAttempt(attemptSeed), fb, normalizer);
    }

    public List<ThemeWord> merge(String theme, int target, Difficulty difficulty, String language) {
        List<ThemeWord> collected = new ArrayList<>();
        if (target <= 0) return collected;
        Set<String> seen = new HashSet<>();

        if (primary != null) {
            extend(primary, theme, target, difficulty, language, collected, seen);
        }
        for (ThemeWordProvider p : fallbacks) {
            if (collected.size() >= target) break;
            extend(p, theme, target, difficulty, language, collected, seen);
        }
        log.debug("Merged {} theme words for '{}' (target {})", collected.size(), theme, target);
        return collected;
    }

    private void extend(ThemeWordProvider provider, String theme, int target, Difficulty difficulty, String language,
                        List<ThemeWord> collected, Set<String> seen) {
        List<ThemeWord> words;
        try {
            words = provider.generate(theme, target, difficulty, language);
        } catch (RuntimeException e) {
            log.warn("Theme provider {} failed: {}", provider.name(), e.toString());
            return;
        }
        if (words == null) return;

        for (ThemeWord w : words) {
            if (collected.size() >= target) break;
            if (w == null) continue;
            String key = normalizer.normalize(w.word());
            if (key.isEmpty() || !seen.add(key)) continue;
            collected.add(w);
        }
    }
}
