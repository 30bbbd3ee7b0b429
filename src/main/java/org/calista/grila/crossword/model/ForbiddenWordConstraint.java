package org.calista.grila.crossword.model;

import java.util.List;

/**
 * An open slot must not repeat a word already placed in the grid.
 */
public final class ForbiddenWordConstraint extends Disjunction {

    private final String slot;
    private final String word;

    ForbiddenWordConstraint(String slot, String word, List<Term[]> pairs) {
        super(pairs);
        this.slot = slot;
        this.word = word;
    }

    public String slot() { return slot; }

    public String word() { return word; }

    @Override
    public String toString() {
        return slot + " != " + word;
    }
}
