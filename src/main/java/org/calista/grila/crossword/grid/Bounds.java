package org.calista.grila.crossword.grid;

public final class Bounds {

    public final int rows;
    public final int cols;

    public Bounds(int rows, int cols) {
        if (rows < 1 || cols < 1) throw new IllegalArgumentException("bounds must be positive: " + rows + "x" + cols);
        this.rows = rows;
        this.cols = cols;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    public boolean contains(GridPos p) {
        return contains(p.row, p.col);
    }

    /** Inside the bottom-right 2x2 corner, where clue boxes are never allowed. */
    public boolean inBottomRightCorner(int row, int col) {
        return row >= rows - 2 && col >= cols - 2;
    }

    public int area() {
        return rows * cols;
    }

    @Override
    public String toString() {
        return rows + "x" + cols;
    }
}
