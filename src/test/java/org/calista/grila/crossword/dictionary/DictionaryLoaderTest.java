package org.calista.grila.crossword.dictionary;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.grila.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DictionaryLoaderTest {

    @TempDir
    Path dir;

    private Path fixture() throws IOException {
        Path tsv = dir.resolve("mini.tsv");
        try (InputStream in = getClass().getResourceAsStream("/dictionary/mini.tsv")) {
            assertNotNull(in, "fixture missing");
            Files.copy(in, tsv);
        }
        return tsv;
    }

    private DictionaryLoader loader(FileIO io) {
        return new DictionaryLoader(io, RomanianWordNormalizer.INSTANCE, new ProcessedDictionaryStore(io, new ObjectMapper()));
    }

    @Test
    void groupsRowsByNormalizedSurface() throws IOException {
        FileIO io = new FileIO(dir);
        List<DictionaryEntry> grouped = loader(io).preprocess(fixture());

        DictionaryEntry casa = grouped.stream().filter(e -> e.surface().equals("CASA")).findFirst().orElseThrow();
        assertEquals(0.90, casa.frequency(), 1e-9);
        assertEquals("locuință a unei familii", casa.definition());
        assertEquals(List.of("casa", "casă"), casa.rawForms());
        assertEquals(12, grouped.size());
    }

    @Test
    void filtersStopwordsCompoundsAndShortWords() throws IOException {
        FileIO io = new FileIO(dir);
        DictionaryLoader.Result result = loader(io).load(fixture(), null, new DictionaryLoader.Config());

        PositionalWordIndex index = result.index;
        assertEquals(9, index.size());
        assertEquals(9, result.report.kept);
        assertEquals(12, result.report.surfaces);
        assertFalse(index.contains("si"));
        assertFalse(index.contains("bună-ziua"));
        assertFalse(index.contains("a"));
        assertTrue(index.contains("pădure"));
        assertFalse(result.report.fromCache);
    }

    @Test
    void secondLoadComesFromProcessedCache() throws IOException {
        FileIO io = new FileIO(dir);
        Path tsv = fixture();
        Path cache = dir.resolve("cache/processed.jsonl");

        DictionaryLoader.Result first = loader(io).load(tsv, cache, new DictionaryLoader.Config());
        assertTrue(Files.exists(cache));
        assertEquals(ProcessedDictionaryStore.SCHEMA_LINE, Files.readAllLines(cache).get(0));

        Files.delete(tsv);
        DictionaryLoader.Result second = loader(io).load(tsv, cache, new DictionaryLoader.Config());

        assertTrue(second.report.fromCache);
        assertEquals(first.index.size(), second.index.size());
        assertEquals("apă curgătoare din natura", second.index.get("rau").orElseThrow().definition());
    }

    @Test
    void maxEntriesPerLengthKeepsBestRanked() throws IOException {
        FileIO io = new FileIO(dir);
        DictionaryLoader.Config cfg = new DictionaryLoader.Config();
        cfg.maxEntriesPerLength = 1;

        PositionalWordIndex index = loader(io).load(fixture(), null, cfg).index;

        assertEquals(1, index.matchingSurfaces(3, null).size());
        assertEquals(1, index.matchingSurfaces(4, null).size());
    }

    @Test
    void missingSourceFails() {
        FileIO io = new FileIO(dir);
        assertThrows(DictionaryLoadException.class,
                () -> loader(io).load(dir.resolve("absent.tsv"), null, null));
    }

    @Test
    void emptyAfterFilteringFails() throws IOException {
        FileIO io = new FileIO(dir);
        DictionaryLoader.Config cfg = new DictionaryLoader.Config();
        cfg.minLength = 20;
        Path tsv = fixture();
        assertThrows(DictionaryLoadException.class, () -> loader(io).load(tsv, null, cfg));
    }
}
