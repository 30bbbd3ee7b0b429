package org.calista.grila.crossword.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Allowed assignments for one slot: its terms must spell one of the tuples, in rank order.
 */
public final class TableConstraint {

    private final String slot;
    private final List<Term> terms;
    private final List<int[]> tuples;

    TableConstraint(String slot, List<Term> terms, List<int[]> tuples) {
        this.slot = slot;
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
        this.tuples = Collections.unmodifiableList(new ArrayList<>(tuples));
    }

    public String slot() { return slot; }

    public List<Term> terms() { return terms; }

    public List<int[]> tuples() { return tuples; }

    @Override
    public String toString() {
        return slot + " in " + tuples.size() + " tuples";
    }
}
