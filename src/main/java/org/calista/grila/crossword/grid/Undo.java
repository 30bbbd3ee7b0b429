package org.calista.grila.crossword.grid;

/**
 * Reversal of one committed grid mutation.
 */
@FunctionalInterface
public interface Undo {
    void undo();
}
