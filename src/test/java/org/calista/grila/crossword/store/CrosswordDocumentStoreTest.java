package org.calista.grila.crossword.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.grila.crossword.clue.ClueAttacher;
import org.calista.grila.crossword.clue.TemplateClueTextProvider;
import org.calista.grila.crossword.dictionary.PositionalWordIndex;
import org.calista.grila.crossword.generate.GenerationResult;
import org.calista.grila.crossword.generate.GenerationSettings;
import org.calista.grila.crossword.grid.*;
import org.calista.grila.crossword.theme.ThemeWord;
import org.calista.grila.crossword.validate.ValidationReport;
import org.calista.grila.io.FileIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CrosswordDocumentStoreTest {

    private static final Instant NOW = Instant.parse("2026-10-17T12:30:05Z");

    private static final PositionalWordIndex INDEX = PositionalWordIndex.builder()
            .addWords("mar", "arc")
            .build();

    @TempDir
    Path tmp;

    private CrosswordDocumentStore store;
    private GenerationSettings settings;

    @BeforeEach
    void setUp() {
        store = new CrosswordDocumentStore(new FileIO(tmp), new ObjectMapper(), "crosswords",
                Clock.fixed(NOW, ZoneOffset.UTC));
        settings = new GenerationSettings();
        settings.rows = 3;
        settings.cols = 3;
        settings.seed = 99L;
        settings.theme = "mare";
    }

    private static void place(CrosswordGrid grid, String id, int row, int col, Direction dir, GridPos box, String word) {
        grid.placeWord(new WordSlot(id, GridPos.of(row, col), dir, word.length(), box, false), word);
    }

    /**
     * <pre>
     *  O # A
     *  M A R
     *  # L C
     * </pre>
     */
    private static GenerationResult result() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(3, 3).build());
        grid.addClueBox(0, 1);
        grid.addClueBox(2, 0);
        GridPos top = GridPos.of(0, 1), left = GridPos.of(2, 0);
        place(grid, "a1", 1, 0, Direction.ACROSS, left, "MAR");
        place(grid, "d1", 0, 2, Direction.DOWN, top, "ARC");
        place(grid, "d2", 0, 0, Direction.DOWN, top, "OM");
        place(grid, "d3", 1, 1, Direction.DOWN, top, "AL");
        place(grid, "a2", 2, 1, Direction.ACROSS, left, "LC");

        Map<String, Clue> clues = new ClueAttacher(new TemplateClueTextProvider()).attach(grid);
        return new GenerationResult(grid, new ArrayList<>(grid.slots()), List.of(new ThemeWord("MARE", "Intindere de apa", "test")),
                clues, new ValidationReport(List.of()), 99L, 1234L, 2, 15L);
    }

    @Test
    void successIsWrittenAndReadBack() throws Exception {
        String id = store.saveSuccess(result(), settings, INDEX);

        assertTrue(id.matches("20261017T123005_[0-9a-f]{8}"), id);
        assertTrue(Files.isRegularFile(tmp.resolve("crosswords").resolve(id + ".json")));

        GridDocument doc = store.load(id);
        assertEquals(id, doc.id);
        assertEquals(NOW.toString(), doc.createdAt);
        assertEquals(GridDocument.STATUS_SUCCESS, doc.status);
        assertNull(doc.error);
        assertEquals(99L, doc.seed);
        assertEquals(1234L, doc.gridSeed);
        assertEquals(2, doc.attempt);
        assertEquals("mare", doc.config.theme);
        assertEquals(3, doc.config.rows);
        assertEquals("MARE", doc.themeWords.get(0).word());

        assertEquals(3, doc.grid.size());
        assertEquals("CLUE_BOX", doc.grid.get(0).get(1).type);
        assertEquals("M", doc.grid.get(1).get(0).letter);
        assertNull(doc.grid.get(2).get(0).letter);
        assertEquals(5, doc.slots.size());
        assertFalse(doc.clues.isEmpty());
        for (GridDocument.ClueDoc c : doc.clues) assertNotNull(c.clueBox);
    }

    @Test
    void statsDescribeTheGrid() throws Exception {
        GridDocument doc = store.load(store.saveSuccess(result(), settings, INDEX));
        GridDocument.Stats s = doc.stats;

        assertEquals(9, s.totalCells);
        assertEquals(7, s.letterCells);
        assertEquals(2, s.clueBoxes);
        assertEquals(0, s.unfilledCells);
        assertEquals(5, s.totalSlots);
        assertEquals(2, s.words3plus);
        assertEquals(Map.of("3", 2), s.lengthDistribution);
        assertEquals(3.0, s.lengthAvg);

        assertNotNull(s.difficulty);
        assertEquals("2/2", s.difficulty.dictCoverage);
        assertEquals(2, s.difficulty.mediumCount);
        assertNull(s.difficulty.themeAvgScore);
    }

    @Test
    void failureKeepsReasonsWithoutGrid() throws Exception {
        String id = store.saveFailure(settings, "Unable to generate", List.of("r1", "r2"), null);

        GridDocument doc = store.load(id);
        assertEquals(GridDocument.STATUS_FAILED, doc.status);
        assertEquals("Unable to generate", doc.error);
        assertEquals(List.of("r1", "r2"), doc.reasons);
        assertEquals(99L, doc.seed);
        assertNull(doc.grid);
        assertNull(doc.stats);
    }

    @Test
    void failureWithPartialGrid() throws Exception {
        CrosswordGrid partial = new CrosswordGrid(GridConfig.builder(3, 3).build());
        partial.addClueBox(0, 0);

        GridDocument doc = store.load(store.saveFailure(settings, "x", List.of(), partial));
        assertEquals(3, doc.grid.size());
        assertEquals(1, doc.stats.clueBoxes);
        assertEquals(8, doc.stats.unfilledCells);
        assertNull(doc.stats.difficulty);
    }

    @Test
    void idsAreUnique() throws Exception {
        String a = store.saveFailure(settings, "x", List.of(), null);
        String b = store.saveFailure(settings, "x", List.of(), null);
        assertNotEquals(a, b);
    }
}
