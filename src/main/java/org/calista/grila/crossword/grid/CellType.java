package org.calista.grila.crossword.grid;

/**
 * Cell state machine: EMPTY -> LETTER (word commit), EMPTY -> CLUE_BOX (licensing / healing / partition),
 * any -> BLOCKER_ZONE (blocker carving). LETTER -> EMPTY only when the last owning slot is removed.
 */
public enum CellType {
    EMPTY,
    LETTER,
    CLUE_BOX,
    BLOCKER_ZONE;

    public boolean isPlayable() {
        return this == EMPTY || this == LETTER;
    }

    public boolean isBlocked() {
        return this == CLUE_BOX || this == BLOCKER_ZONE;
    }
}
