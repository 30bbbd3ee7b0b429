package org.calista.grila.crossword.model;

import org.calista.grila.crossword.grid.GridPos;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ConstraintModel — solver-agnostic description of the fill problem.
 *
 * <p>
 * Variables: one per empty cell, domain A..Z. Constraints: one table per slot with variables,
 * pairwise differences between same-length slots, exclusions of already placed words.
 * A model may be marked infeasible at build time (for example two identical fully fixed slots).
 * </p>
 */
public final class ConstraintModel {

    private final List<GridPos> variables;
    private final List<ModelSlot> slots;
    private final List<TableConstraint> tables;
    private final List<DifferenceConstraint> differences;
    private final List<ForbiddenWordConstraint> forbidden;
    private final String infeasibleReason; // nullable

    ConstraintModel(List<GridPos> variables, List<ModelSlot> slots, List<TableConstraint> tables,
                    List<DifferenceConstraint> differences, List<ForbiddenWordConstraint> forbidden,
                    String infeasibleReason) {
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
        this.differences = Collections.unmodifiableList(new ArrayList<>(differences));
        this.forbidden = Collections.unmodifiableList(new ArrayList<>(forbidden));
        this.infeasibleReason = infeasibleReason;
    }

    public int variableCount() { return variables.size(); }

    /** Grid cell behind variable {@code i}. */
    public GridPos variablePosition(int i) { return variables.get(i); }

    public List<GridPos> variables() { return variables; }

    public List<ModelSlot> slots() { return slots; }

    public List<TableConstraint> tables() { return tables; }

    public List<DifferenceConstraint> differences() { return differences; }

    public List<ForbiddenWordConstraint> forbidden() { return forbidden; }

    public boolean isTriviallyInfeasible() { return infeasibleReason != null; }

    public String infeasibleReason() { return infeasibleReason; }

    /** All disjunctive constraints, differences first. */
    public List<Disjunction> disjunctions() {
        List<Disjunction> out = new ArrayList<>(differences.size() + forbidden.size());
        out.addAll(differences);
        out.addAll(forbidden);
        return out;
    }

    /**
     * Word spelled by {@code slot} under a complete assignment.
     */
    public String wordOf(ModelSlot slot, int[] assignment) {
        StringBuilder sb = new StringBuilder(slot.length());
        for (Term t : slot.terms()) {
            int v = t.resolve(assignment);
            if (v < 0 || v >= Term.ALPHABET) throw new IllegalStateException("Unassigned term " + t + " in " + slot.key());
            sb.append(Term.decode(v));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ConstraintModel{vars=" + variables.size() + ", slots=" + slots.size() + ", tables=" + tables.size()
                + ", differences=" + differences.size() + ", forbidden=" + forbidden.size()
                + (infeasibleReason != null ? ", infeasible=" + infeasibleReason : "") + '}';
    }
}
