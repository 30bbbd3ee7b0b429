package org.calista.grila.crossword.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A registered run that holds (or will hold) one word.
 * The licensing clue box and the text change as the grid evolves; geometry does not.
 */
public final class WordSlot {

    private final String id;
    private final GridPos start;
    private final Direction direction;
    private final int length;
    private final boolean theme;

    private GridPos clueBox;
    private String text; // null until committed

    private List<GridPos> cells; // lazy

    public WordSlot(String id, GridPos start, Direction direction, int length, GridPos clueBox, boolean theme) {
        this.id = Objects.requireNonNull(id, "id");
        this.start = Objects.requireNonNull(start, "start");
        this.direction = Objects.requireNonNull(direction, "direction");
        if (length < 1) throw new IllegalArgumentException("slot length must be >= 1: " + length);
        this.length = length;
        this.clueBox = Objects.requireNonNull(clueBox, "clueBox");
        this.theme = theme;
    }

    public String id() { return id; }

    public GridPos start() { return start; }

    public Direction direction() { return direction; }

    public int length() { return length; }

    public GridPos clueBox() { return clueBox; }

    public String text() { return text; }

    public boolean isTheme() { return theme; }

    public boolean isFilled() { return text != null; }

    public GridPos end() {
        return direction.step(start, length - 1);
    }

    /** Occupancy key shared with {@link SlotSignature#key()}. */
    public String key() {
        return SlotSignature.key(start, direction, length);
    }

    public List<GridPos> cells() {
        if (cells == null) {
            List<GridPos> out = new ArrayList<>(length);
            for (int i = 0; i < length; i++) out.add(direction.step(start, i));
            cells = Collections.unmodifiableList(out);
        }
        return cells;
    }

    void clueBox(GridPos clueBox) {
        this.clueBox = Objects.requireNonNull(clueBox, "clueBox");
    }

    void text(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return id + "[" + start + " " + direction + " " + length + (text == null ? "" : " " + text) + "]";
    }
}
