package org.calista.grila.crossword.theme;

import org.calista.grila.crossword.dictionary.Difficulty;

import java.util.List;

/**
 * Source of theme seed words. Implementations may fail (network, quota); callers go through
 * {@link ThemeWordMerger}, which tolerates that.
 */
public interface ThemeWordProvider {

    List<ThemeWord> generate(String theme, int limit, Difficulty difficulty, String language);

    /**
     * Instance for one generation attempt. Providers with per-run state return a fresh one;
     * stateless providers return {@code this}.
     */
    default ThemeWordProvider forAttempt(long attemptSeed) {
        return this;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
