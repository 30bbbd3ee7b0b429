package org.calista.grila.crossword.generate;

import org.calista.grila.crossword.grid.Clue;
import org.calista.grila.crossword.grid.CrosswordGrid;
import org.calista.grila.crossword.grid.WordSlot;
import org.calista.grila.crossword.theme.ThemeWord;
import org.calista.grila.crossword.validate.ValidationReport;

import java.util.*;

/**
 * A validated, clued grid plus how it was produced.
 */
public final class GenerationResult {
    public final CrosswordGrid grid;
    public final List<WordSlot> slots;
    public final List<ThemeWord> themeWords;
    /** Slot id -> attached clue. */
    public final Map<String, Clue> clues;
    public final ValidationReport validation;

    public final long seed;
    public final long gridSeed;
    public final int attempt;
    public final long tookMs;

    public GenerationResult(CrosswordGrid grid, List<WordSlot> slots, List<ThemeWord> themeWords,
                            Map<String, Clue> clues, ValidationReport validation,
                            long seed, long gridSeed, int attempt, long tookMs) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
        this.themeWords = Collections.unmodifiableList(new ArrayList<>(themeWords));
        this.clues = Collections.unmodifiableMap(new LinkedHashMap<>(clues));
        this.validation = Objects.requireNonNull(validation, "validation");
        this.seed = seed;
        this.gridSeed = gridSeed;
        this.attempt = attempt;
        this.tookMs = tookMs;
    }

    public List<String> words() {
        List<String> out = new ArrayList<>(slots.size());
        for (WordSlot s : slots) out.add(s.text());
        return out;
    }

    public GenerationResult withSeed(long newSeed) {
        return new GenerationResult(grid, slots, themeWords, clues, validation, newSeed, gridSeed, attempt, tookMs);
    }
}
