package org.calista.grila.crossword.layout;

import org.calista.grila.crossword.core.CrosswordException;

/**
 * Layout cannot be completed for this geometry: unhealable isolated cell or infeasible slot.
 */
public class LayoutException extends CrosswordException {
    public LayoutException(String message) {
        super(message);
    }

    public LayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
