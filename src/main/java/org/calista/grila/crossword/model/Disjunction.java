package org.calista.grila.crossword.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * "Differ in at least one position": a disjunction of per-position inequalities {@code a[i] != b[i]}.
 * Positions where both sides are equal constants are dropped at construction.
 */
public abstract class Disjunction {

    private final List<Term[]> pairs;

    protected Disjunction(List<Term[]> pairs) {
        this.pairs = Collections.unmodifiableList(new ArrayList<>(pairs));
    }

    public List<Term[]> pairs() {
        return pairs;
    }

    /**
     * @return {@code true} when every pair is resolved and equal under {@code assignment} (-1 = unassigned)
     */
    public boolean isViolated(int[] assignment) {
        for (Term[] p : pairs) {
            int a = p[0].resolve(assignment);
            int b = p[1].resolve(assignment);
            if (a < 0 || b < 0 || a != b) return false;
        }
        return true;
    }

    /**
     * Builds the pairs for two equal-length term lists.
     *
     * @return {@code null} when some position is provably different (constraint always holds);
     *         an empty list when both sides are identical constants (constraint can never hold)
     */
    static List<Term[]> differingPairs(List<Term> a, List<Term> b) {
        if (a.size() != b.size()) throw new IllegalArgumentException("length mismatch: " + a.size() + " vs " + b.size());
        List<Term[]> out = new ArrayList<>();
        for (int i = 0; i < a.size(); i++) {
            Term x = a.get(i), y = b.get(i);
            if (!x.isVariable() && !y.isVariable()) {
                if (x.value() != y.value()) return null;
                continue;
            }
            out.add(new Term[]{x, y});
        }
        return out;
    }
}
