package org.calista.grila.crossword.theme;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.dictionary.DictionaryEntry;
import org.calista.grila.crossword.dictionary.Difficulty;
import org.calista.grila.crossword.dictionary.WordIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Theme words taken from the loaded dictionary: entries whose definition or lemma mention the theme.
 * The definition becomes the clue.
 */
public final class DictionaryThemeWordProvider implements ThemeWordProvider {

    private static final Logger log = LogManager.getLogger(DictionaryThemeWordProvider.class);

    public static final String SOURCE = "dictionary";

    private final WordIndex index;

    public DictionaryThemeWordProvider(WordIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    @Override
    public List<ThemeWord> generate(String theme, int limit, Difficulty difficulty, String language) {
        List<ThemeWord> out = new ArrayList<>();
        if (theme == null || theme.isBlank() || limit <= 0) return out;

        for (DictionaryEntry e : index.themeCandidates(theme.trim().toLowerCase(Locale.ROOT), limit)) {
            if (e.length() < 2) continue;
            String clue = e.definition() == null || e.definition().isBlank() ? e.surface() : e.definition();
            out.add(new ThemeWord(e.surface(), clue, SOURCE));
        }
        log.debug("Dictionary provider matched {} entries for '{}'", out.size(), theme);
        return out;
    }

    @Override
    public String name() {
        return SOURCE;
    }
}
