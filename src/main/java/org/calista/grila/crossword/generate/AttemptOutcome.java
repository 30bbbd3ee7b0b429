package org.calista.grila.crossword.generate;

import java.util.Objects;

/**
 * Result of one attempt: OK with a result, RETRY with a reason (new seed may help), FATAL (it will not).
 */
public final class AttemptOutcome {

    public enum Kind { OK, RETRY, FATAL }

    private final Kind kind;
    private final GenerationResult result;
    private final String reason;

    private AttemptOutcome(Kind kind, GenerationResult result, String reason) {
        this.kind = kind;
        this.result = result;
        this.reason = reason;
    }

    public static AttemptOutcome ok(GenerationResult result) {
        return new AttemptOutcome(Kind.OK, Objects.requireNonNull(result, "result"), null);
    }

    public static AttemptOutcome retry(String reason) {
        return new AttemptOutcome(Kind.RETRY, null, reason == null ? "unknown" : reason);
    }

    public static AttemptOutcome fatal(String reason) {
        return new AttemptOutcome(Kind.FATAL, null, reason == null ? "unknown" : reason);
    }

    public Kind kind() { return kind; }

    public boolean isOk() { return kind == Kind.OK; }

    public GenerationResult result() {
        if (result == null) throw new IllegalStateException("No result for " + kind + ": " + reason);
        return result;
    }

    /** {@code null} for OK. */
    public String reason() { return reason; }

    @Override
    public String toString() {
        return kind == Kind.OK ? "OK" : kind + "(" + reason + ")";
    }
}
