package org.calista.grila.crossword.grid;

/**
 * Immutable (row, col). Natural order is row-major.
 */
public final class GridPos implements Comparable<GridPos> {

    public final int row;
    public final int col;

    public GridPos(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public static GridPos of(int row, int col) {
        return new GridPos(row, col);
    }

    public GridPos offset(int dr, int dc) {
        return new GridPos(row + dr, col + dc);
    }

    @Override
    public int compareTo(GridPos o) {
        int c = Integer.compare(row, o.row);
        return c != 0 ? c : Integer.compare(col, o.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridPos)) return false;
        GridPos p = (GridPos) o;
        return row == p.row && col == p.col;
    }

    @Override
    public int hashCode() {
        return row * 31 + col;
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
