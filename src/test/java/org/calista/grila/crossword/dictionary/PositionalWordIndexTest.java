package org.calista.grila.crossword.dictionary;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class PositionalWordIndexTest {

    @Test
    void patternLookupIntersectsPositions() {
        PositionalWordIndex index = PositionalWordIndex.builder().addWords("ab", "ba", "abc").build();

        assertEquals(Set.of("BA"), index.matchingSurfaces(2, Arrays.asList(null, 'A')));
        assertEquals(Set.of("AB", "BA"), index.matchingSurfaces(2, Arrays.asList(null, null)));
        assertTrue(index.matchingSurfaces(2, Arrays.asList('C', null)).isEmpty());
        assertTrue(index.matchingSurfaces(4, null).isEmpty());
    }

    @Test
    void bannedWordsAreExcluded() {
        PositionalWordIndex index = PositionalWordIndex.builder().addWords("ab", "ba").build();

        List<DictionaryEntry> out = index.findCandidates(
                CandidateQuery.builder(2).banned(List.of("AB")).build());

        assertEquals(1, out.size());
        assertEquals("BA", out.get(0).surface());
        assertEquals(1, index.countCandidates(2, null, Set.of("AB")));
        assertFalse(index.hasCandidates(2, Arrays.asList('A', null), Set.of("AB")));
    }

    @Test
    void rankingFollowsScoreThenSurface() {
        PositionalWordIndex index = PositionalWordIndex.builder()
                .add(DictionaryEntry.of("MAL", 0.2, 0.45))
                .add(DictionaryEntry.of("LAC", 0.9, 0.45))
                .add(DictionaryEntry.of("CAL", 0.9, 0.45))
                .build();

        List<DictionaryEntry> out = index.findCandidates(CandidateQuery.builder(3).build());

        assertEquals(List.of("CAL", "LAC", "MAL"), surfaces(out));
    }

    @Test
    void preferredWordsAreBoosted() {
        PositionalWordIndex index = PositionalWordIndex.builder()
                .add(DictionaryEntry.of("MAL", 0.5, 0.45))
                .add(DictionaryEntry.of("LAC", 0.6, 0.45))
                .build();

        List<DictionaryEntry> out = index.findCandidates(
                CandidateQuery.builder(3).preferred(List.of("MAL")).build());

        assertEquals("MAL", out.get(0).surface());
    }

    @Test
    void limitCapsResults() {
        PositionalWordIndex index = PositionalWordIndex.builder().addWords("mar", "par", "car", "bar").build();
        assertEquals(2, index.findCandidates(CandidateQuery.builder(3).limit(2).build()).size());
    }

    @Test
    void fallbackPoolMixesMediumRankedWords() {
        PositionalWordIndex index = PositionalWordIndex.builder()
                .difficulty(Difficulty.HARD)
                .add(DictionaryEntry.of("AAA", 0.5, 0.95))
                .add(DictionaryEntry.of("BBB", 0.5, 0.90))
                .add(DictionaryEntry.of("CCC", 0.5, 0.85))
                .add(DictionaryEntry.of("DDD", 0.5, 0.45))
                .build();

        List<DictionaryEntry> plain = index.findCandidates(CandidateQuery.builder(3).limit(2).build());
        List<DictionaryEntry> mixed = index.findCandidates(
                CandidateQuery.builder(3).limit(2).fallbackFraction(0.5).build());

        assertEquals(List.of("CCC", "BBB"), surfaces(plain));
        assertEquals(List.of("CCC", "DDD"), surfaces(mixed));
    }

    @Test
    void lookupNormalizesInput() {
        PositionalWordIndex index = PositionalWordIndex.builder().addWords("pădure").build();
        assertTrue(index.contains("padure"));
        assertTrue(index.contains("PĂDURE"));
        assertEquals("PADURE", index.get("Pădure").orElseThrow().surface());
        assertFalse(index.contains(null));
    }

    @Test
    void rejectsNonLatinSurfaces() {
        assertThrows(IllegalArgumentException.class,
                () -> PositionalWordIndex.builder().add(DictionaryEntry.of("ĂLA", 0.5, 0.5)));
    }

    @Test
    void themeCandidatesScanDefinitions() {
        PositionalWordIndex index = PositionalWordIndex.builder()
                .add(new DictionaryEntry("RAU", "râu", "apa curgatoare din natura", 0.7, 0.4, false, false, List.of()))
                .add(new DictionaryEntry("CAR", "car", "vehicul", 0.7, 0.4, false, false, List.of()))
                .build();

        assertEquals(List.of("RAU"), surfaces(index.themeCandidates(" Natura ", 10)));
        assertTrue(index.themeCandidates("natura", 0).isEmpty());
        assertTrue(index.themeCandidates("", 5).isEmpty());
    }

    @Test
    void scoreOrdersTiersForHardWords() {
        DictionaryEntry hard = DictionaryEntry.of("ZZZ", 0.5, 0.8);
        assertTrue(hard.score(Difficulty.HARD) > hard.score(Difficulty.MEDIUM));
        assertTrue(hard.score(Difficulty.MEDIUM) > hard.score(Difficulty.EASY));
    }

    private static List<String> surfaces(List<DictionaryEntry> entries) {
        return entries.stream().map(DictionaryEntry::surface).collect(java.util.stream.Collectors.toList());
    }

    // ---------------------------------------------------------------------
    // Randomized agreement with a linear scan
    // ---------------------------------------------------------------------

    private static final char[] LETTERS = {'A', 'B', 'C', 'D'};

    private static Set<String> scan(Collection<String> words, int length, List<Character> pattern) {
        Set<String> out = new HashSet<>();
        for (String w : words) {
            if (w.length() != length) continue;
            boolean ok = true;
            for (int i = 0; i < length && ok; i++) {
                Character ch = pattern.get(i);
                if (ch != null && w.charAt(i) != ch) ok = false;
            }
            if (ok) out.add(w);
        }
        return out;
    }

    private static Set<String> surfaceSet(List<DictionaryEntry> entries) {
        Set<String> out = new HashSet<>();
        for (DictionaryEntry e : entries) out.add(e.surface());
        return out;
    }

    @Test
    void lookupsAgreeWithLinearScan() {
        Random rnd = new Random(2024);
        Set<String> words = new HashSet<>();
        while (words.size() < 300) {
            int len = 2 + rnd.nextInt(4);
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < len; i++) sb.append(LETTERS[rnd.nextInt(LETTERS.length)]);
            words.add(sb.toString());
        }
        PositionalWordIndex index = PositionalWordIndex.builder().addWords(words.toArray(new String[0])).build();
        assertEquals(words.size(), index.size());

        for (int round = 0; round < 200; round++) {
            int len = 2 + rnd.nextInt(4);
            List<Character> pattern = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                pattern.add(rnd.nextInt(3) == 0 ? LETTERS[rnd.nextInt(LETTERS.length)] : null);
            }
            List<Character> open = Arrays.asList(new Character[len]);

            Set<String> expected = scan(words, len, pattern);
            Set<String> all = surfaceSet(index.findCandidates(CandidateQuery.builder(len).limit(10_000).build()));
            Set<String> found = surfaceSet(index.findCandidates(
                    CandidateQuery.builder(len).pattern(pattern).limit(10_000).build()));

            assertEquals(expected, index.matchingSurfaces(len, pattern), "pattern " + pattern);
            assertEquals(expected, found, "pattern " + pattern);
            assertEquals(scan(words, len, open), all);
            assertTrue(all.containsAll(found), "pattern " + pattern);

            Set<String> banned = new HashSet<>();
            for (String w : expected) {
                if (rnd.nextBoolean()) banned.add(w);
            }
            assertEquals(expected.size() - banned.size(), index.countCandidates(len, pattern, banned), "pattern " + pattern);
            assertEquals(expected.size() > banned.size(), index.hasCandidates(len, pattern, banned));
        }
    }
}
