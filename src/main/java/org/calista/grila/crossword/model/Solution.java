package org.calista.grila.crossword.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Solver outcome. Only FEASIBLE carries an assignment, and it is always complete.
 */
public final class Solution {

    public enum Status {
        FEASIBLE,
        INFEASIBLE,
        TIMEOUT
    }

    private final Status status;
    private final int[] assignment; // null unless FEASIBLE
    private final String detail;

    private Solution(Status status, int[] assignment, String detail) {
        this.status = status;
        this.assignment = assignment;
        this.detail = detail == null ? "" : detail;
    }

    public static Solution feasible(int[] assignment) {
        Objects.requireNonNull(assignment, "assignment");
        for (int i = 0; i < assignment.length; i++) {
            if (assignment[i] < 0 || assignment[i] >= Term.ALPHABET) {
                throw new IllegalArgumentException("Partial assignment: variable " + i + " = " + assignment[i]);
            }
        }
        return new Solution(Status.FEASIBLE, assignment.clone(), "");
    }

    public static Solution infeasible(String detail) {
        return new Solution(Status.INFEASIBLE, null, detail);
    }

    public static Solution timeout(String detail) {
        return new Solution(Status.TIMEOUT, null, detail);
    }

    public Status status() { return status; }

    public boolean isFeasible() { return status == Status.FEASIBLE; }

    public String detail() { return detail; }

    /** @throws IllegalStateException unless FEASIBLE */
    public int[] assignment() {
        if (assignment == null) throw new IllegalStateException("No assignment for status " + status);
        return assignment.clone();
    }

    @Override
    public String toString() {
        return status + (detail.isEmpty() ? "" : " (" + detail + ")")
                + (assignment != null ? " vars=" + assignment.length : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Solution)) return false;
        Solution s = (Solution) o;
        return status == s.status && Arrays.equals(assignment, s.assignment);
    }

    @Override
    public int hashCode() {
        return 31 * status.hashCode() + Arrays.hashCode(assignment);
    }
}
