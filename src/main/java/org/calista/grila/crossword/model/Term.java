package org.calista.grila.crossword.model;

/**
 * One cell of a slot inside the model: a fixed letter or a solver variable.
 * Letters are encoded 0..25 for A..Z.
 */
public final class Term {

    public static final int ALPHABET = 26;

    private final int variable; // -1 for constants
    private final int value;    // -1 for variables

    private Term(int variable, int value) {
        this.variable = variable;
        this.value = value;
    }

    public static Term constant(char letter) {
        int v = encode(letter);
        if (v < 0) throw new IllegalArgumentException("letter must be A-Z: " + letter);
        return new Term(-1, v);
    }

    public static Term variable(int index) {
        if (index < 0) throw new IllegalArgumentException("variable index must be >= 0: " + index);
        return new Term(index, -1);
    }

    public static int encode(char letter) {
        return (letter >= 'A' && letter <= 'Z') ? letter - 'A' : -1;
    }

    public static char decode(int value) {
        return (char) ('A' + value);
    }

    public boolean isVariable() {
        return variable >= 0;
    }

    public int variable() {
        return variable;
    }

    /** Constant value; {@code -1} for variables. */
    public int value() {
        return value;
    }

    /** Value under {@code assignment}, or {@code -1} while the variable is unassigned. */
    public int resolve(int[] assignment) {
        return isVariable() ? assignment[variable] : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Term)) return false;
        Term t = (Term) o;
        return variable == t.variable && value == t.value;
    }

    @Override
    public int hashCode() {
        return variable * 31 + value;
    }

    @Override
    public String toString() {
        return isVariable() ? "v" + variable : String.valueOf(decode(value));
    }
}
