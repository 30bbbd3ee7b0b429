package org.calista.grila.crossword.dictionary;

import java.text.Normalizer;

/**
 * Romanian normalization: ă â î ș ş ț ţ (any case) fold to their base letters, other combining marks
 * are stripped, everything that is not A-Z is dropped.
 */
public final class RomanianWordNormalizer implements WordNormalizer {

    public static final RomanianWordNormalizer INSTANCE = new RomanianWordNormalizer();

    @Override
    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) return "";

        StringBuilder folded = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            folded.append(foldRomanian(raw.charAt(i)));
        }

        String decomposed = Normalizer.normalize(folded, Normalizer.Form.NFD);
        StringBuilder out = new StringBuilder(decomposed.length());
        for (int i = 0; i < decomposed.length(); i++) {
            char ch = Character.toUpperCase(decomposed.charAt(i));
            if (ch >= 'A' && ch <= 'Z') out.append(ch);
        }
        return out.toString();
    }

    private static char foldRomanian(char ch) {
        switch (ch) {
            case 'ă': case 'â': case 'Ă': case 'Â':
                return 'a';
            case 'î': case 'Î':
                return 'i';
            case 'ș': case 'ş': case 'Ș': case 'Ş':
                return 's';
            case 'ț': case 'ţ': case 'Ț': case 'Ţ':
                return 't';
            default:
                return ch;
        }
    }
}
