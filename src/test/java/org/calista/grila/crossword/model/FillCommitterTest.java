package org.calista.grila.crossword.model;

import org.calista.grila.crossword.grid.*;
import org.calista.grila.crossword.layout.PlacementLedger;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FillCommitterTest {

    private static WordSlot down(CrosswordGrid grid, PlacementLedger ledger, String id, int row, int col, int box, String word) {
        WordSlot slot = new WordSlot(id, GridPos.of(row, col), Direction.DOWN, word.length(), GridPos.of(0, box), false);
        grid.placeWord(slot, word);
        ledger.register(slot);
        ledger.markUsed(word);
        return slot;
    }

    @Test
    void crossingsThatCompleteARunGetRegistered() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(4, 4).build());
        grid.addClueBox(0, 0);
        grid.addClueBox(0, 2);
        PlacementLedger ledger = new PlacementLedger();
        down(grid, ledger, "d1", 0, 1, 0, "MARE");
        down(grid, ledger, "d2", 0, 3, 2, "CASA");
        down(grid, ledger, "d3", 1, 0, 0, "ARC");
        down(grid, ledger, "d4", 1, 2, 2, "RAC");

        List<WordSlot> registered = new FillCommitter().registerPrefilledRuns(grid, ledger);

        // rows 2 and 3 have no clue box within reach and stay unregistered
        assertEquals(1, registered.size());
        WordSlot row = registered.get(0);
        assertEquals("AARA", row.text());
        assertEquals(GridPos.of(1, 0), row.start());
        assertEquals(GridPos.of(0, 0), row.clueBox());
        assertTrue(ledger.isOccupied(row.key()));
        assertTrue(ledger.usedWords().contains("AARA"));
        assertEquals(2, grid.cell(1, 0).slotIds().size());
        assertEquals(16 - 2, grid.filledCount());
    }

    @Test
    void nothingToRegisterOnAnOpenGrid() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(4, 4).plantOriginClue(true).build());
        assertTrue(new FillCommitter().registerPrefilledRuns(grid, new PlacementLedger()).isEmpty());
    }
}
