package org.calista.grila.crossword.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Every rule violation found in one pass; empty means valid.
 */
public final class ValidationReport {

    private final List<String> messages;

    public ValidationReport(List<String> messages) {
        this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public boolean ok() {
        return messages.isEmpty();
    }

    public List<String> messages() {
        return messages;
    }

    @Override
    public String toString() {
        return ok() ? "valid" : messages.size() + " violation(s): " + messages;
    }
}
