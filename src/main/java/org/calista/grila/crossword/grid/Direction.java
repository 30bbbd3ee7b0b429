package org.calista.grila.crossword.grid;

import java.util.ArrayList;
import java.util.List;

/**
 * Slot direction with its step vector and the clue-box offsets (relative to the slot start)
 * that may license it, in preference order.
 */
public enum Direction {
    // clue offsets: left, up, down
    ACROSS(0, 1, new int[][]{{0, -1}, {-1, 0}, {1, 0}}),
    // clue offsets: up, left, right
    DOWN(1, 0, new int[][]{{-1, 0}, {0, -1}, {0, 1}});

    public final int dr;
    public final int dc;
    private final int[][] clueOffsets;

    Direction(int dr, int dc, int[][] clueOffsets) {
        this.dr = dr;
        this.dc = dc;
        this.clueOffsets = clueOffsets;
    }

    /** Position {@code n} steps from {@code from} along this direction (n may be negative). */
    public GridPos step(GridPos from, int n) {
        return from.offset(dr * n, dc * n);
    }

    /** Candidate clue-box positions for a slot starting at {@code start}; bounds are not checked. */
    public List<GridPos> clueCandidates(GridPos start) {
        List<GridPos> out = new ArrayList<>(clueOffsets.length);
        for (int[] o : clueOffsets) out.add(start.offset(o[0], o[1]));
        return out;
    }

    public boolean isClueOffset(GridPos start, GridPos clue) {
        for (int[] o : clueOffsets) {
            if (start.row + o[0] == clue.row && start.col + o[1] == clue.col) return true;
        }
        return false;
    }
}
