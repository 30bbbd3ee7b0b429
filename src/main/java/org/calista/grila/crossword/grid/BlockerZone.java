package org.calista.grila.crossword.grid;

/**
 * Rectangular non-playable region reserved for artwork. Clipped to the grid on carving.
 */
public final class BlockerZone {

    public final int row;
    public final int col;
    public final int height;
    public final int width;

    public BlockerZone(int row, int col, int height, int width) {
        if (height < 1 || width < 1) throw new IllegalArgumentException("blocker size must be positive");
        this.row = row;
        this.col = col;
        this.height = height;
        this.width = width;
    }

    public boolean contains(int r, int c) {
        return r >= row && r < row + height && c >= col && c < col + width;
    }

    public boolean anchoredAtOrigin() {
        return row == 0 && col == 0;
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ") " + height + "x" + width;
    }
}
