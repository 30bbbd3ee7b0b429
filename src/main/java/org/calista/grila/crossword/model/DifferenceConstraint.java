package org.calista.grila.crossword.model;

import java.util.List;

/**
 * Two same-length open slots must not receive the same word.
 */
public final class DifferenceConstraint extends Disjunction {

    private final String slotA;
    private final String slotB;

    DifferenceConstraint(String slotA, String slotB, List<Term[]> pairs) {
        super(pairs);
        this.slotA = slotA;
        this.slotB = slotB;
    }

    public String slotA() { return slotA; }

    public String slotB() { return slotB; }

    @Override
    public String toString() {
        return slotA + " != " + slotB + " (" + pairs().size() + " positions)";
    }
}
