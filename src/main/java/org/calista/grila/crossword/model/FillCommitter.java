package org.calista.grila.crossword.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.grid.CrosswordGrid;
import org.calista.grila.crossword.grid.GridPos;
import org.calista.grila.crossword.grid.PlacementException;
import org.calista.grila.crossword.grid.SlotSignature;
import org.calista.grila.crossword.grid.UndoStack;
import org.calista.grila.crossword.grid.WordSlot;
import org.calista.grila.crossword.layout.PlacementLedger;
import org.calista.grila.crossword.layout.SlotScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FillCommitter — writes solved words back into the grid through {@link CrosswordGrid#placeWord}.
 *
 * <p>Only complete FEASIBLE solutions are accepted. Each committed word gets a fresh slot id,
 * is registered in the ledger and becomes a used word.</p>
 */
public final class FillCommitter {

    private static final Logger log = LogManager.getLogger(FillCommitter.class);

    /**
     * Registers open runs that crossings have already filled completely, so they get a slot, a license
     * and a place in the used-word set before the model is built.
     *
     * @return registered slots
     */
    public List<WordSlot> registerPrefilledRuns(CrosswordGrid grid, PlacementLedger ledger) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(ledger, "ledger");

        List<WordSlot> out = new ArrayList<>();
        for (SlotSignature run : SlotScanner.openRuns(grid, ledger)) {
            String word = grid.wordAt(run.cells());
            if (word == null) continue;
            Optional<GridPos> box = grid.findLicensingClueBox(run.start(), run.direction());
            if (box.isEmpty()) {
                log.debug("Prefilled run {} has no licensing clue box", run.key());
                continue;
            }
            out.add(commitOne(grid, ledger, run, box.get(), word));
        }
        if (!out.isEmpty()) log.debug("Registered {} prefilled runs", out.size());
        return out;
    }

    /**
     * @throws IllegalArgumentException for a non-feasible solution or one that does not fit the model
     * @throws PlacementException if a word no longer fits the grid; nothing is committed then
     */
    public List<WordSlot> commit(CrosswordGrid grid, PlacementLedger ledger, ConstraintModel model, Solution solution) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(ledger, "ledger");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(solution, "solution");
        if (!solution.isFeasible()) {
            throw new IllegalArgumentException("Cannot commit a " + solution.status() + " solution");
        }
        int[] assignment = solution.assignment();
        if (assignment.length != model.variableCount()) {
            throw new IllegalArgumentException("Partial assignment: " + assignment.length + " of " + model.variableCount() + " variables");
        }

        List<WordSlot> out = new ArrayList<>(model.slots().size());
        UndoStack journal = new UndoStack();
        try {
            for (ModelSlot ms : model.slots()) {
                SlotSignature run = ms.signature();
                WordSlot slot = new WordSlot(ledger.nextSlotId(run.direction()), run.start(), run.direction(),
                        run.length(), ms.clueBox(), false);
                journal.push(grid.placeWordUndoable(slot, model.wordOf(ms, assignment)));
                out.add(slot);
            }
        } catch (PlacementException e) {
            journal.rollback();
            throw e;
        }
        journal.commit();

        for (WordSlot slot : out) {
            ledger.register(slot);
            ledger.markUsed(slot.text());
        }
        log.debug("Committed {} fill words", out.size());
        return out;
    }

    private static WordSlot commitOne(CrosswordGrid grid, PlacementLedger ledger, SlotSignature run, GridPos box, String word) {
        WordSlot slot = new WordSlot(ledger.nextSlotId(run.direction()), run.start(), run.direction(), run.length(), box, false);
        grid.placeWord(slot, word);
        ledger.register(slot);
        ledger.markUsed(word);
        return slot;
    }
}
