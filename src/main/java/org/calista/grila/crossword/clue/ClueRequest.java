package org.calista.grila.crossword.clue;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.grila.crossword.grid.Direction;
import org.calista.grila.crossword.grid.GridPos;
import org.calista.grila.crossword.grid.WordSlot;

import java.util.Objects;

/**
 * One clue to write: the slot, its solution word and where the clue is printed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ClueRequest {
    public final String slotId;
    public final String word;
    public final Direction direction;
    public final int clueRow;
    public final int clueCol;

    public ClueRequest(String slotId, String word, Direction direction, GridPos clueBox) {
        this.slotId = Objects.requireNonNull(slotId, "slotId");
        this.word = Objects.requireNonNull(word, "word");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.clueRow = clueBox.row;
        this.clueCol = clueBox.col;
    }

    public static ClueRequest of(WordSlot slot) {
        if (!slot.isFilled()) throw new IllegalArgumentException("Slot " + slot.id() + " has no word");
        return new ClueRequest(slot.id(), slot.text(), slot.direction(), slot.clueBox());
    }

    @Override
    public String toString() {
        return slotId + ":" + word + " " + direction + " @(" + clueRow + "," + clueCol + ")";
    }
}
