package org.calista.grila.crossword.grid;

import java.util.Objects;

/**
 * Clue record hosted by a clue box. The offset points from the hosting box to the slot start.
 */
public final class Clue {

    private final String id;
    private final String text;
    private final String slotId;
    private final int solutionLength;
    private final Direction direction;
    private final int offsetRow;
    private final int offsetCol;

    public Clue(String id, String text, String slotId, int solutionLength, Direction direction,
                int offsetRow, int offsetCol) {
        this.id = Objects.requireNonNull(id, "id");
        this.text = text == null ? "" : text;
        this.slotId = Objects.requireNonNull(slotId, "slotId");
        this.solutionLength = solutionLength;
        this.direction = Objects.requireNonNull(direction, "direction");
        this.offsetRow = offsetRow;
        this.offsetCol = offsetCol;
    }

    /** Clue for {@code slot} hosted at {@code box}; offset computed from the slot start. */
    public static Clue forSlot(String id, String text, WordSlot slot, GridPos box) {
        return new Clue(id, text, slot.id(), slot.length(), slot.direction(),
                slot.start().row - box.row, slot.start().col - box.col);
    }

    public String id() { return id; }

    public String text() { return text; }

    public String slotId() { return slotId; }

    public int solutionLength() { return solutionLength; }

    public Direction direction() { return direction; }

    public int offsetRow() { return offsetRow; }

    public int offsetCol() { return offsetCol; }

    public Clue withOffset(int offsetRow, int offsetCol) {
        return new Clue(id, text, slotId, solutionLength, direction, offsetRow, offsetCol);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Clue)) return false;
        Clue c = (Clue) o;
        return solutionLength == c.solutionLength
                && offsetRow == c.offsetRow
                && offsetCol == c.offsetCol
                && id.equals(c.id)
                && text.equals(c.text)
                && slotId.equals(c.slotId)
                && direction == c.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, text, slotId, solutionLength, direction, offsetRow, offsetCol);
    }

    @Override
    public String toString() {
        return id + "[" + slotId + " " + direction + " " + solutionLength + " @" + offsetRow + "," + offsetCol + "]";
    }
}
