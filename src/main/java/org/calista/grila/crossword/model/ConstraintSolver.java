package org.calista.grila.crossword.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Opaque fill solver. Must return within {@code budget} and before {@code deadline};
 * on exhaustion it answers TIMEOUT, never a partial assignment.
 */
public interface ConstraintSolver {

    Solution solve(ConstraintModel model, Duration budget, Instant deadline);
}
