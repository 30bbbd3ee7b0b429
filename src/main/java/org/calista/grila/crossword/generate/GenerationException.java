package org.calista.grila.crossword.generate;

import org.calista.grila.crossword.core.CrosswordException;

import java.util.Collections;
import java.util.List;

/**
 * Generation gave up: retries exhausted or a fatal precondition failed.
 */
public class GenerationException extends CrosswordException {

    private final List<String> reasons;

    public GenerationException(String message, List<String> reasons) {
        super(message + (reasons == null || reasons.isEmpty() ? "" : ": " + reasons));
        this.reasons = reasons == null ? List.of() : Collections.unmodifiableList(reasons);
    }

    /** Per-attempt failure reasons, in attempt order. */
    public List<String> reasons() {
        return reasons;
    }
}
