package org.calista.grila.crossword.layout;

import org.calista.grila.crossword.grid.*;

import java.util.*;

/**
 * SlotScanner — run detection over the current cell state.
 *
 * <p>A run is a maximal sequence of playable cells in one direction; it becomes a slot candidate at length 2+.</p>
 */
public final class SlotScanner {

    private SlotScanner() {}

    /**
     * Maximal run through {@code seed} in {@code dir}.
     *
     * @return empty when {@code seed} is not playable or the run is shorter than 2
     */
    public static Optional<SlotSignature> signatureThrough(CrosswordGrid grid, GridPos seed, Direction dir) {
        if (!grid.isPlayable(seed)) return Optional.empty();

        GridPos start = seed;
        while (grid.isPlayable(dir.step(start, -1))) start = dir.step(start, -1);

        List<GridPos> cells = new ArrayList<>();
        GridPos cur = start;
        while (grid.isPlayable(cur)) {
            cells.add(cur);
            cur = dir.step(cur, 1);
        }
        if (cells.size() < 2) return Optional.empty();
        return Optional.of(new SlotSignature(start, dir, cells));
    }

    public static boolean isFullyFilled(CrosswordGrid grid, SlotSignature sig) {
        return grid.wordAt(sig.cells()) != null;
    }

    /**
     * Every run of length 2+ not registered in {@code ledger}, deduplicated, row-major with across before down.
     */
    public static List<SlotSignature> openRuns(CrosswordGrid grid, PlacementLedger ledger) {
        Set<String> seen = new HashSet<>();
        List<SlotSignature> out = new ArrayList<>();
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                GridPos p = GridPos.of(r, c);
                if (!grid.cell(p).isPlayable()) continue;
                for (Direction dir : Direction.values()) {
                    if (!grid.isBoundary(p, dir)) continue;
                    Optional<SlotSignature> sig = signatureThrough(grid, p, dir);
                    if (sig.isEmpty()) continue;
                    String key = sig.get().key();
                    if (ledger != null && ledger.isOccupied(key)) continue;
                    if (seen.add(key)) out.add(sig.get());
                }
            }
        }
        return out;
    }

    /** Boundary starts whose {@code length} cells are all in bounds and unblocked. */
    public static List<GridPos> candidateStarts(CrosswordGrid grid, int length, Direction dir) {
        List<GridPos> out = new ArrayList<>();
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                GridPos p = GridPos.of(r, c);
                if (grid.isBoundary(p, dir) && !overlapsBlock(grid, p, dir, length)) out.add(p);
            }
        }
        return out;
    }

    public static boolean overlapsBlock(CrosswordGrid grid, GridPos start, Direction dir, int length) {
        for (int i = 0; i < length; i++) {
            if (!grid.isPlayable(dir.step(start, i))) return true;
        }
        return false;
    }

    /** Fits without blocked cells or letter conflicts. */
    public static boolean canPlaceWord(CrosswordGrid grid, GridPos start, Direction dir, String word) {
        for (int i = 0; i < word.length(); i++) {
            GridPos p = dir.step(start, i);
            if (!grid.isPlayable(p)) return false;
            Cell cell = grid.cell(p);
            if (cell.hasLetter() && cell.letter() != word.charAt(i)) return false;
        }
        return true;
    }

    /** An adjacent clue box exists, or an EMPTY allowed-offset cell could become one. */
    public static boolean startHasClueCapacity(CrosswordGrid grid, GridPos start, Direction dir) {
        for (GridPos candidate : dir.clueCandidates(start)) {
            if (!grid.inBounds(candidate)) continue;
            Cell cell = grid.cell(candidate);
            if (cell.isClueBox()) return true;
            if (cell.isEmpty() && grid.canPlaceClueBox(candidate)) return true;
        }
        return false;
    }

    public static boolean hasAdjacentClue(CrosswordGrid grid, GridPos start, Direction dir) {
        for (GridPos candidate : dir.clueCandidates(start)) {
            if (grid.inBounds(candidate) && grid.cell(candidate).isClueBox()) return true;
        }
        return false;
    }
}
