package org.calista.grila.crossword.theme;

import org.calista.grila.crossword.dictionary.Difficulty;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BucketThemeWordProviderTest {

    private static List<String> words(List<ThemeWord> list) {
        return list.stream().map(ThemeWord::word).collect(Collectors.toList());
    }

    @Test
    void sameSeedGivesSameWords() {
        List<ThemeWord> a = new BucketThemeWordProvider(11L).generate("natura", 20, Difficulty.MEDIUM, "Romanian");
        List<ThemeWord> b = new BucketThemeWordProvider(11L).generate("natura", 20, Difficulty.MEDIUM, "Romanian");

        assertEquals(20, a.size());
        assertEquals(words(a), words(b));
    }

    @Test
    void repeatedCallsDoNotAdvanceState() {
        BucketThemeWordProvider provider = new BucketThemeWordProvider(7L);
        List<ThemeWord> first = provider.generate("natura", 6, Difficulty.MEDIUM, "Romanian");
        List<ThemeWord> second = provider.generate("natura", 6, Difficulty.MEDIUM, "Romanian");
        assertEquals(words(first), words(second));
    }

    @Test
    void attemptInstancesDependOnlyOnTheirSeed() {
        BucketThemeWordProvider provider = new BucketThemeWordProvider(7L);
        ThemeWordProvider a = provider.forAttempt(1234L);

        // another attempt in between must not change what attempt 1234 sees
        provider.forAttempt(99L).generate("natura", 20, Difficulty.MEDIUM, "Romanian");
        ThemeWordProvider b = provider.forAttempt(1234L);

        assertNotSame(provider, a);
        assertEquals(words(a.generate("natura", 20, Difficulty.MEDIUM, "Romanian")),
                words(b.generate("natura", 20, Difficulty.MEDIUM, "Romanian")));
    }

    @Test
    void onTierWordsComeFirst() {
        Map<Difficulty, List<String>> tiers = Map.of(
                Difficulty.EASY, List.of("brad", "lac"),
                Difficulty.MEDIUM, List.of("codru"),
                Difficulty.HARD, List.of("gorun"));
        BucketThemeWordProvider provider = new BucketThemeWordProvider(Map.of("Natura", tiers), 1L);

        List<String> out = words(provider.generate(" NATURA ", 10, Difficulty.HARD, "Romanian"));

        assertEquals(4, out.size());
        assertEquals("GORUN", out.get(0));
        assertTrue(out.containsAll(List.of("BRAD", "LAC", "CODRU")));
    }

    @Test
    void cluesNameTheThemeAndSource() {
        ThemeWord w = new BucketThemeWordProvider(3L).generate("istorie", 1, Difficulty.EASY, "Romanian").get(0);

        assertEquals(BucketThemeWordProvider.SOURCE, w.source());
        assertEquals("Rezerva istorie: " + w.word().toLowerCase(java.util.Locale.ROOT), w.clue());
    }

    @Test
    void unknownThemeUsesFallbackBucket() {
        List<ThemeWord> out = new BucketThemeWordProvider(5L).generate("astronomie", 100, Difficulty.MEDIUM, "Romanian");
        assertEquals(19, out.size());
        assertTrue(words(out).contains("DUNARE"));
    }

    @Test
    void blankThemeIsLabelledGenerically() {
        ThemeWord w = new BucketThemeWordProvider(5L).generate("  ", 1, null, null).get(0);
        assertTrue(w.clue().startsWith("Rezerva tema: "));
    }

    @Test
    void defaultThemesAreAvailable() {
        assertTrue(new BucketThemeWordProvider(0L).themes().containsAll(List.of("mitologie", "istorie", "natura")));
    }
}
