package org.calista.grila.crossword.theme;

import org.calista.grila.crossword.core.CrosswordException;

/**
 * No theme words at all, or placed theme letters below the coverage floor.
 */
public class ThemeWordException extends CrosswordException {
    public ThemeWordException(String message) {
        super(message);
    }
}
