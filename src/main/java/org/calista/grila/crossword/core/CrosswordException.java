package org.calista.grila.crossword.core;

/**
 * Base of the engine's unchecked failures. Subclasses tell the caller how far the failure reaches:
 * a single placement, the current attempt, or the whole generation.
 */
public class CrosswordException extends RuntimeException {

    public CrosswordException(String message) {
        super(message);
    }

    public CrosswordException(String message, Throwable cause) {
        super(message, cause);
    }
}
