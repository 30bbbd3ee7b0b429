package org.calista.grila.crossword.theme;

import org.calista.grila.crossword.dictionary.DictionaryEntry;
import org.calista.grila.crossword.dictionary.Difficulty;
import org.calista.grila.crossword.dictionary.PositionalWordIndex;
import org.calista.grila.crossword.dictionary.RomanianWordNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThemeWordMergerTest {

    private static ThemeWordProvider fixed(String source, String... words) {
        return (theme, limit, difficulty, language) -> {
            java.util.List<ThemeWord> out = new java.util.ArrayList<>();
            for (String w : words) out.add(new ThemeWord(w, "clue " + w, source));
            return out;
        };
    }

    @Test
    void primaryWinsAndDuplicatesAreDropped() {
        ThemeWordMerger merger = new ThemeWordMerger(
                fixed("primary", "pădure", "râu"),
                List.of(fixed("fallback", "PADURE", "munte", "lac")),
                RomanianWordNormalizer.INSTANCE);

        List<ThemeWord> out = merger.merge("natura", 10, Difficulty.MEDIUM, "Romanian");

        assertEquals(4, out.size());
        assertEquals("pădure", out.get(0).word());
        assertEquals("primary", out.get(0).source());
        assertEquals("munte", out.get(2).word());
    }

    @Test
    void failingProviderIsSkipped() {
        ThemeWordProvider broken = (theme, limit, difficulty, language) -> {
            throw new IllegalStateException("quota exceeded");
        };
        ThemeWordMerger merger = new ThemeWordMerger(broken, List.of(fixed("fallback", "lac", "brad")),
                RomanianWordNormalizer.INSTANCE);

        List<ThemeWord> out = merger.merge("natura", 5, Difficulty.EASY, "Romanian");

        assertEquals(2, out.size());
        assertEquals("fallback", out.get(0).source());
    }

    @Test
    void resultIsCappedAtTarget() {
        ThemeWordMerger merger = new ThemeWordMerger(null,
                List.of(fixed("a", "lac", "brad"), fixed("b", "munte", "cerb")),
                RomanianWordNormalizer.INSTANCE);

        assertEquals(3, merger.merge("natura", 3, Difficulty.MEDIUM, "Romanian").size());
        assertTrue(merger.merge("natura", 0, Difficulty.MEDIUM, "Romanian").isEmpty());
    }

    @Test
    void dictionaryProviderUsesDefinitionsAsClues() {
        PositionalWordIndex index = PositionalWordIndex.builder()
                .add(new DictionaryEntry("RAU", "râu", "apa curgatoare din natura", 0.7, 0.4, false, false, List.of()))
                .add(new DictionaryEntry("LAC", "lac", "", 0.7, 0.4, false, false, List.of()))
                .add(new DictionaryEntry("CAR", "natura", "", 0.7, 0.4, false, false, List.of()))
                .build();

        List<ThemeWord> out = new DictionaryThemeWordProvider(index).generate("Natura", 10, Difficulty.MEDIUM, "Romanian");

        assertEquals(2, out.size());
        ThemeWord rau = out.stream().filter(w -> w.word().equals("RAU")).findFirst().orElseThrow();
        ThemeWord car = out.stream().filter(w -> w.word().equals("CAR")).findFirst().orElseThrow();
        assertEquals("apa curgatoare din natura", rau.clue());
        assertEquals("CAR", car.clue());
        assertEquals(DictionaryThemeWordProvider.SOURCE, rau.source());
    }
}
