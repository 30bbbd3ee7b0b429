package org.calista.grila.crossword.validate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.dictionary.WordIndex;
import org.calista.grila.crossword.grid.*;

import java.util.*;

/**
 * GridValidator — independent post-condition oracle over raw cell state.
 *
 * <p>
 * Не доверяет реестру слотов: runs выводятся заново из клеток. Собирает все нарушения, а не первое.
 * Результат не чинится постфактум: невалидная сетка = провал попытки.
 * </p>
 */
public final class GridValidator {

    private static final Logger log = LogManager.getLogger(GridValidator.class);

    private final WordIndex index;

    public GridValidator(WordIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * @param themeSurfaces normalized theme words accepted even when missing from the dictionary
     */
    public ValidationReport validate(CrosswordGrid grid, Set<String> themeSurfaces) {
        Objects.requireNonNull(grid, "grid");
        Set<String> theme = themeSurfaces == null ? Set.of() : themeSurfaces;

        List<String> messages = new ArrayList<>();
        checkClueBoxes(grid, messages);
        checkCells(grid, messages);
        checkCounters(grid, messages);
        checkRuns(grid, theme, messages);

        ValidationReport report = new ValidationReport(messages);
        if (!report.ok()) log.debug("Validation failed: {}", report);
        return report;
    }

    private static void checkClueBoxes(CrosswordGrid grid, List<String> messages) {
        Bounds b = grid.bounds();
        for (int r = 0; r < b.rows; r++) {
            for (int c = 0; c < b.cols; c++) {
                GridPos p = GridPos.of(r, c);
                if (!grid.cell(p).isClueBox()) continue;

                if (grid.licensesOf(p).isEmpty()) {
                    messages.add("Clue box at " + p + " does not license any word");
                }
                if (b.inBottomRightCorner(r, c)) {
                    messages.add("Clue box at " + p + " is in the bottom-right 2x2 corner");
                }
                // right and down only: each adjacent pair is reported once
                GridPos right = p.offset(0, 1), down = p.offset(1, 0);
                if (b.contains(right) && grid.cell(right).isClueBox()) {
                    messages.add("Clue box adjacency violation between " + p + " and " + right);
                }
                if (b.contains(down) && grid.cell(down).isClueBox()) {
                    messages.add("Clue box adjacency violation between " + p + " and " + down);
                }
            }
        }
    }

    private static void checkCells(CrosswordGrid grid, List<String> messages) {
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                GridPos p = GridPos.of(r, c);
                Cell cell = grid.cell(p);
                switch (cell.type()) {
                    case EMPTY -> {
                        boolean reachable = false;
                        for (GridPos n : grid.neighbors(p)) {
                            if (grid.cell(n).isPlayable()) {
                                reachable = true;
                                break;
                            }
                        }
                        if (!reachable) messages.add("Isolated unreachable cell at " + p);
                        messages.add("Unfilled cell at " + p);
                        if (cell.hasLetter() || !cell.slotIds().isEmpty()) {
                            messages.add("Empty cell at " + p + " carries word state");
                        }
                    }
                    case LETTER -> {
                        char ch = cell.letter();
                        if (ch < 'A' || ch > 'Z') messages.add("Invalid letter '" + ch + "' at " + p);
                        if (cell.slotIds().isEmpty()) messages.add("Letter at " + p + " belongs to no slot");
                    }
                    case CLUE_BOX, BLOCKER_ZONE -> {
                        if (cell.hasLetter() || !cell.slotIds().isEmpty()) {
                            messages.add(cell.type() + " at " + p + " carries word state");
                        }
                    }
                }
            }
        }
    }

    private static void checkCounters(CrosswordGrid grid, List<String> messages) {
        int playable = 0, filled = 0;
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                Cell cell = grid.cell(r, c);
                if (cell.isPlayable()) playable++;
                if (cell.type() == CellType.LETTER) filled++;
            }
        }
        if (playable != grid.playableCount()) {
            messages.add("Playable counter " + grid.playableCount() + " != " + playable + " playable cells");
        }
        if (filled != grid.filledCount()) {
            messages.add("Filled counter " + grid.filledCount() + " != " + filled + " letter cells");
        }
    }

    private void checkRuns(CrosswordGrid grid, Set<String> theme, List<String> messages) {
        Map<String, GridPos> seen = new HashMap<>();
        for (SlotSignature run : grid.enumerateLetterRuns()) {
            String word = grid.wordAt(run.cells());
            if (word == null) continue;

            GridPos first = seen.putIfAbsent(word, run.start());
            if (first != null) {
                messages.add("Duplicate word '" + word + "' at " + run.start() + " (first at " + first + ")");
            }
            if (run.length() >= 3 && !theme.contains(word) && !index.contains(word)) {
                messages.add("Invalid word '" + word + "' at " + run.start());
            }
            if (grid.findLicensingClueBox(run.start(), run.direction()).isEmpty()) {
                messages.add("Slot " + run.key() + " missing valid clue adjacency");
            }
        }
    }
}
