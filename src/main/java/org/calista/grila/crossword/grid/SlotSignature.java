package org.calista.grila.crossword.grid;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ephemeral run-detection result: a maximal run of playable cells in one direction.
 * Never persisted; rebuilt whenever the grid changes.
 */
public final class SlotSignature {

    private final GridPos start;
    private final Direction direction;
    private final List<GridPos> cells;

    public SlotSignature(GridPos start, Direction direction, List<GridPos> cells) {
        this.start = Objects.requireNonNull(start, "start");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.cells = Collections.unmodifiableList(cells);
    }

    public static String key(GridPos start, Direction direction, int length) {
        return start.row + ":" + start.col + ":" + direction + ":" + length;
    }

    public GridPos start() { return start; }

    public Direction direction() { return direction; }

    public List<GridPos> cells() { return cells; }

    public int length() { return cells.size(); }

    public String key() {
        return key(start, direction, cells.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SlotSignature)) return false;
        SlotSignature s = (SlotSignature) o;
        return direction == s.direction && start.equals(s.start) && cells.size() == s.cells.size();
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, direction, cells.size());
    }

    @Override
    public String toString() {
        return key();
    }
}
