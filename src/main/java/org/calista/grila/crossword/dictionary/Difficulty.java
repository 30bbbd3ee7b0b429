package org.calista.grila.crossword.dictionary;

/**
 * Difficulty tier of a puzzle. Each tier has a centre on the 0..1 difficulty-score axis.
 */
public enum Difficulty {
    EASY(0.15),
    MEDIUM(0.45),
    HARD(0.80);

    private final double center;

    Difficulty(double center) {
        this.center = center;
    }

    public double center() {
        return center;
    }

    /** Lenient parse for config values; unknown or blank falls back to MEDIUM. */
    public static Difficulty parse(String s) {
        if (s == null || s.isBlank()) return MEDIUM;
        try {
            return Difficulty.valueOf(s.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
