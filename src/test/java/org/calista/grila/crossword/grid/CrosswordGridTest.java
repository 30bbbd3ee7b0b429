package org.calista.grila.crossword.grid;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CrosswordGridTest {

    private static CrosswordGrid open(int rows, int cols) {
        return new CrosswordGrid(GridConfig.builder(rows, cols).build());
    }

    @Test
    void placingFirstWordCreatesLicensingClueBox() {
        CrosswordGrid grid = open(6, 6);
        GridPos start = GridPos.of(0, 0);

        GridPos box = grid.ensureClueBox(start, Direction.ACROSS, null);
        WordSlot slot = new WordSlot("t1", start, Direction.ACROSS, 4, box, true);
        grid.placeWord(slot, "cerb");
        grid.ensureTerminalBoundary(slot, null);

        assertEquals(GridPos.of(1, 0), box);
        assertTrue(grid.cell(box).isClueBox());
        assertTrue(grid.licensesOf(box).contains("t1"));
        assertEquals("CERB", grid.wordAt(slot.cells()));
        assertEquals(4, grid.filledCount());
        assertEquals(35, grid.playableCount());

        for (GridPos p : grid.clueBoxes()) {
            assertFalse(p.row >= 4 && p.col >= 4, "clue box in bottom-right corner: " + p);
        }
    }

    @Test
    void undoRestoresCellsExactly() {
        CrosswordGrid grid = open(5, 5);
        GridPos box = grid.ensureClueBox(GridPos.of(0, 0), Direction.DOWN, null);
        Cell[][] before = grid.snapshotCells();
        int filledBefore = grid.filledCount();

        WordSlot slot = new WordSlot("s1", GridPos.of(0, 0), Direction.DOWN, 3, box, false);
        Undo undo = grid.placeWordUndoable(slot, "ARE");
        assertEquals(CellType.LETTER, grid.cell(2, 0).type());

        undo.undo();

        assertGridEquals(before, grid.snapshotCells());
        assertEquals(filledBefore, grid.filledCount());
        assertTrue(grid.slot("s1").isEmpty());
        assertFalse(slot.isFilled());
        assertTrue(grid.licensesOf(box).isEmpty());
    }

    @Test
    void journalRollbackRemovesCreatedClueBoxes() {
        CrosswordGrid grid = open(5, 5);
        Cell[][] fresh = grid.snapshotCells();
        UndoStack journal = new UndoStack();

        GridPos start = GridPos.of(2, 0);
        GridPos box = grid.ensureClueBox(start, Direction.ACROSS, journal);
        journal.push(grid.placeWordUndoable(new WordSlot("a", start, Direction.ACROSS, 3, box, false), "SAC"));
        assertEquals(24, grid.playableCount());

        journal.rollback();

        assertGridEquals(fresh, grid.snapshotCells());
        assertEquals(25, grid.playableCount());
        assertEquals(0, grid.filledCount());
        assertTrue(grid.clueBoxes().isEmpty());
    }

    @Test
    void sharedCellSurvivesRemovalOfOneOwner() {
        CrosswordGrid grid = open(6, 6);
        GridPos acrossBox = grid.ensureClueBox(GridPos.of(1, 1), Direction.ACROSS, null);
        grid.placeWord(new WordSlot("a", GridPos.of(1, 1), Direction.ACROSS, 3, acrossBox, false), "CAL");
        GridPos downBox = grid.ensureClueBox(GridPos.of(1, 2), Direction.DOWN, null);
        grid.placeWord(new WordSlot("d", GridPos.of(1, 2), Direction.DOWN, 3, downBox, false), "ARC");

        assertEquals(5, grid.filledCount());
        assertEquals(2, grid.cell(1, 2).slotIds().size());

        grid.removeWord("a");

        assertEquals('A', grid.cell(1, 2).letter());
        assertEquals(CellType.LETTER, grid.cell(1, 2).type());
        assertEquals(CellType.EMPTY, grid.cell(1, 1).type());
        assertEquals(3, grid.filledCount());
    }

    @Test
    void conflictingPlacementLeavesGridUntouched() {
        CrosswordGrid grid = open(5, 5);
        GridPos box = grid.ensureClueBox(GridPos.of(2, 1), Direction.ACROSS, null);
        grid.placeWord(new WordSlot("a", GridPos.of(2, 1), Direction.ACROSS, 3, box, false), "MAR");

        GridPos downBox = grid.ensureClueBox(GridPos.of(1, 2), Direction.DOWN, null);
        assertEquals(GridPos.of(0, 2), downBox);
        Cell[][] before = grid.snapshotCells();
        int filledBefore = grid.filledCount();
        WordSlot clash = new WordSlot("d", GridPos.of(1, 2), Direction.DOWN, 3, downBox, false);

        assertThrows(PlacementException.class, () -> grid.placeWord(clash, "OSA"));
        assertGridEquals(before, grid.snapshotCells());
        assertEquals(filledBefore, grid.filledCount());
        assertFalse(clash.isFilled());
        assertTrue(grid.slot("d").isEmpty());
    }

    @Test
    void placementWithoutLicenseIsRejected() {
        CrosswordGrid grid = open(5, 5);
        WordSlot slot = new WordSlot("a", GridPos.of(0, 1), Direction.ACROSS, 3, GridPos.of(0, 0), false);
        assertThrows(PlacementException.class, () -> grid.placeWord(slot, "RAC"));
        assertEquals(0, grid.filledCount());
    }

    @Test
    void lengthMismatchIsRejected() {
        CrosswordGrid grid = open(5, 5);
        GridPos box = grid.ensureClueBox(GridPos.of(0, 0), Direction.ACROSS, null);
        WordSlot slot = new WordSlot("a", GridPos.of(0, 0), Direction.ACROSS, 3, box, false);
        assertThrows(PlacementException.class, () -> grid.placeWord(slot, "CASA"));
    }

    @Test
    void clueBoxRulesAreEnforced() {
        CrosswordGrid grid = open(6, 6);

        assertFalse(grid.canPlaceClueBox(5, 5));
        assertFalse(grid.canPlaceClueBox(4, 4));
        assertThrows(ClueBoxException.class, () -> grid.addClueBox(4, 5));

        grid.addClueBox(2, 2);
        assertFalse(grid.canPlaceClueBox(2, 3), "adjacent to an existing clue box");
        assertFalse(grid.canPlaceClueBox(2, 2), "already a clue box");
        assertTrue(grid.canPlaceClueBox(2, 4));

        // (0,0) keeps (0,1) or (1,0); boxing both would isolate it
        grid.addClueBox(0, 1);
        assertFalse(grid.canPlaceClueBox(1, 0));
    }

    @Test
    void ensureClueBoxReusesLeastLoadedExistingBox() {
        CrosswordGrid grid = open(6, 6);
        grid.addClueBox(1, 2);
        GridPos box = grid.ensureClueBox(GridPos.of(1, 3), Direction.ACROSS, null);
        assertEquals(GridPos.of(1, 2), box);
        assertEquals(1, grid.clueBoxes().size());
    }

    @Test
    void terminalBoundaryBecomesClueBox() {
        CrosswordGrid grid = open(6, 8);
        GridPos box = grid.ensureClueBox(GridPos.of(2, 0), Direction.ACROSS, null);
        WordSlot slot = new WordSlot("a", GridPos.of(2, 0), Direction.ACROSS, 3, box, false);
        grid.placeWord(slot, "LAC");

        var follow = grid.ensureTerminalBoundary(slot, null);

        assertTrue(grid.cell(2, 3).isClueBox());
        assertEquals(GridPos.of(2, 4), follow.orElseThrow());
    }

    @Test
    void terminalBoundaryIsNotForcedBeforeShortRemainder() {
        CrosswordGrid grid = open(5, 5);
        GridPos box = grid.ensureClueBox(GridPos.of(2, 0), Direction.ACROSS, null);
        WordSlot slot = new WordSlot("a", GridPos.of(2, 0), Direction.ACROSS, 3, box, false);
        grid.placeWord(slot, "LAC");

        assertTrue(grid.ensureTerminalBoundary(slot, null).isEmpty());
        assertTrue(grid.cell(2, 3).isEmpty());
    }

    @Test
    void blockerOverrideCarvesRectangleAndLicensesCorners() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(8, 8).blockerOverride(0, 0, 3, 3).build());

        BlockerZone zone = grid.blockerZone().orElseThrow();
        assertTrue(zone.anchoredAtOrigin());
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) assertEquals(CellType.BLOCKER_ZONE, grid.cell(r, c).type());
        }
        assertTrue(grid.cell(0, 3).isClueBox());
        assertTrue(grid.cell(3, 0).isClueBox());
        assertEquals(64 - 9 - 2, grid.playableCount());
    }

    @Test
    void seededBlockerZoneIsDeterministic() {
        GridConfig cfg = GridConfig.builder(10, 10).blockerZone(true).seed(42L).build();
        BlockerZone a = new CrosswordGrid(cfg).blockerZone().orElseThrow();
        BlockerZone b = new CrosswordGrid(cfg).blockerZone().orElseThrow();

        assertEquals(a.toString(), b.toString());
        assertTrue(a.height >= 3 && a.height <= 5);
        assertTrue(a.width >= 3 && a.width <= 5);
    }

    @Test
    void originCluePlantedWhenConfigured() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(5, 5).plantOriginClue(true).build());
        assertTrue(grid.cell(0, 0).isClueBox());
        assertEquals(1, grid.orphanClueBoxes().size());
    }

    @Test
    void letterRunsAreEnumeratedFromBoundaries() {
        CrosswordGrid grid = open(5, 5);
        GridPos box = grid.ensureClueBox(GridPos.of(0, 0), Direction.ACROSS, null);
        grid.placeWord(new WordSlot("a", GridPos.of(0, 0), Direction.ACROSS, 5, box, false), "ARIPA");

        var runs = grid.enumerateLetterRuns();
        assertEquals(1, runs.size());
        assertEquals("ARIPA", grid.wordAt(runs.get(0).cells()));
    }

    @Test
    void renderShowsSymbols() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(3, 4).plantOriginClue(true).build());
        String out = GridFormatter.render(grid);
        assertTrue(out.contains(" #"));
        assertTrue(out.contains(" ."));
        assertEquals(5, out.split("\n").length);
    }

    private static void assertGridEquals(Cell[][] expected, Cell[][] actual) {
        assertEquals(expected.length, actual.length);
        for (int r = 0; r < expected.length; r++) {
            for (int c = 0; c < expected[r].length; c++) {
                assertEquals(expected[r][c], actual[r][c], "cell (" + r + "," + c + ")");
            }
        }
    }
}
