package org.calista.grila.crossword.generate;

/**
 * Attempt lifecycle callbacks. The generator does not guard them: an exception propagates out of {@code generate()}.
 */
public interface GenerationListener {

    GenerationListener NOOP = new GenerationListener() {
    };

    default void attemptStarted(int attempt, long gridSeed) {
    }

    default void attemptRetry(int attempt, long gridSeed, String reason) {
    }

    default void attemptOk(int attempt, GenerationResult result) {
    }

    default void generationFailed(String reason) {
    }
}
