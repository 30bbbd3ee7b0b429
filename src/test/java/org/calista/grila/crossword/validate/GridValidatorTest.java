package org.calista.grila.crossword.validate;

import org.calista.grila.crossword.dictionary.PositionalWordIndex;
import org.calista.grila.crossword.grid.*;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GridValidatorTest {

    private static final PositionalWordIndex INDEX = PositionalWordIndex.builder()
            .addWords("mar", "arc", "casa", "mare")
            .build();

    private final GridValidator validator = new GridValidator(INDEX);

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
    private static CrosswordGrid filled3x3() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(3, 3).build());
        grid.addClueBox(0, 1);
        grid.addClueBox(2, 0);
        GridPos top = GridPos.of(0, 1), left = GridPos.of(2, 0);
        place(grid, "a1", 1, 0, Direction.ACROSS, left, "MAR");
        place(grid, "d1", 0, 2, Direction.DOWN, top, "ARC");
        place(grid, "d2", 0, 0, Direction.DOWN, top, "OM");
        place(grid, "d3", 1, 1, Direction.DOWN, top, "AL");
        place(grid, "a2", 2, 1, Direction.ACROSS, left, "LC");
        return grid;
    }

    @Test
    void completeGridPasses() {
        ValidationReport report = validator.validate(filled3x3(), Set.of());
        assertTrue(report.ok(), report.toString());
        assertTrue(report.messages().isEmpty());
    }

    @Test
    void unfilledCellsAndOrphanBoxesAreReported() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(1, 5).build());
        grid.addClueBox(0, 0);

        ValidationReport report = validator.validate(grid, Set.of());

        assertFalse(report.ok());
        assertEquals(4, report.messages().stream().filter(m -> m.startsWith("Unfilled cell at")).count());
        assertTrue(report.messages().contains("Clue box at " + GridPos.of(0, 0) + " does not license any word"));
    }

    @Test
    void themeWordsBypassTheDictionary() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(1, 5).build());
        grid.addClueBox(0, 0);
        place(grid, "t", 0, 1, Direction.ACROSS, GridPos.of(0, 0), "ZEUS");

        assertTrue(validator.validate(grid, Set.of("ZEUS")).ok());

        ValidationReport plain = validator.validate(grid, Set.of());
        assertEquals(1, plain.messages().size());
        assertTrue(plain.messages().get(0).startsWith("Invalid word 'ZEUS'"));
    }

    @Test
    void duplicateWordsAreReported() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(1, 10).build());
        grid.addClueBox(0, 0);
        place(grid, "a", 0, 1, Direction.ACROSS, GridPos.of(0, 0), "CASA");
        grid.addClueBox(0, 5);
        place(grid, "b", 0, 6, Direction.ACROSS, GridPos.of(0, 5), "CASA");

        ValidationReport report = validator.validate(grid, Set.of());

        assertEquals(1, report.messages().size());
        assertTrue(report.messages().get(0).startsWith("Duplicate word 'CASA'"));
    }

    @Test
    void unlicensedCrossRunsAreReported() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(4, 4).build());
        grid.addClueBox(0, 0);
        grid.addClueBox(0, 2);
        place(grid, "d1", 0, 1, Direction.DOWN, GridPos.of(0, 0), "MARE");
        place(grid, "d2", 0, 3, Direction.DOWN, GridPos.of(0, 2), "CASA");
        place(grid, "d3", 1, 0, Direction.DOWN, GridPos.of(0, 0), "ARC");
        place(grid, "d4", 1, 2, Direction.DOWN, GridPos.of(0, 2), "MAR");

        ValidationReport report = validator.validate(grid, Set.of());

        // rows 2 and 3 spell RRAS and CERA without a reachable clue box
        assertTrue(report.messages().contains("Slot " + SlotSignature.key(GridPos.of(2, 0), Direction.ACROSS, 4)
                + " missing valid clue adjacency"), report.toString());
        assertTrue(report.messages().stream().anyMatch(m -> m.startsWith("Invalid word 'RRAS'")), report.toString());
        assertTrue(report.messages().stream().anyMatch(m -> m.startsWith("Invalid word 'CERA'")), report.toString());
    }
}
