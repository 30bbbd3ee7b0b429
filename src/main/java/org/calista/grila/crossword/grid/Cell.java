package org.calista.grila.crossword.grid;

import java.util.*;

/**
 * Cell — one grid square.
 *
 * <p>
 * Инвариант: LETTER &lt;=&gt; есть буква и хотя бы один владеющий слот.
 * Мутации только через {@link CrosswordGrid}; наружу отдаются read-only представления.
 * </p>
 */
public final class Cell {

    public static final char NO_LETTER = '\0';

    CellType type = CellType.EMPTY;
    char letter = NO_LETTER;
    final SortedSet<String> slotIds = new TreeSet<>();
    final List<Clue> clues = new ArrayList<>();

    Cell() {
    }

    public CellType type() { return type; }

    public char letter() { return letter; }

    public boolean hasLetter() { return letter != NO_LETTER; }

    public boolean isPlayable() { return type.isPlayable(); }

    public boolean isEmpty() { return type == CellType.EMPTY; }

    public boolean isClueBox() { return type == CellType.CLUE_BOX; }

    public Set<String> slotIds() { return Collections.unmodifiableSet(slotIds); }

    public List<Clue> clues() { return Collections.unmodifiableList(clues); }

    /** Detached snapshot; mutations of the grid do not leak into it. */
    public Cell copy() {
        Cell c = new Cell();
        c.type = type;
        c.letter = letter;
        c.slotIds.addAll(slotIds);
        c.clues.addAll(clues);
        return c;
    }

    void reset(CellType newType) {
        type = newType;
        letter = NO_LETTER;
        slotIds.clear();
        clues.clear();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cell)) return false;
        Cell c = (Cell) o;
        return type == c.type && letter == c.letter && slotIds.equals(c.slotIds) && clues.equals(c.clues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, letter, slotIds, clues);
    }

    @Override
    public String toString() {
        return switch (type) {
            case LETTER -> String.valueOf(letter) + slotIds;
            case CLUE_BOX -> "#" + clues.size();
            case BLOCKER_ZONE -> "X";
            case EMPTY -> ".";
        };
    }
}
