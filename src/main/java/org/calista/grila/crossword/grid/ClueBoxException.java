package org.calista.grila.crossword.grid;

import org.calista.grila.crossword.core.CrosswordException;

/**
 * No valid clue-box position: adjacency, bottom-right corner, isolation or cell type.
 */
public class ClueBoxException extends CrosswordException {
    public ClueBoxException(String message) {
        super(message);
    }
}
