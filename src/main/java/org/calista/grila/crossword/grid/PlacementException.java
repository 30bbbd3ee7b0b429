package org.calista.grila.crossword.grid;

import org.calista.grila.crossword.core.CrosswordException;

/**
 * Word commit rejected: letter conflict, blocked cell, out of bounds or collision at the terminal cell.
 * Always caught and rolled back by the search.
 */
public class PlacementException extends CrosswordException {
    public PlacementException(String message) {
        super(message);
    }
}
