package org.calista.grila.crossword.grid;

/**
 * GridConfig — immutable geometry of one grid.
 *
 * <p>
 * Blocker zone: random size in [minBlockerSize, min(maxBlockerSize, max(3, side/2))] at one of five anchors,
 * or an explicit rectangle via {@link Builder#blockerOverride(int, int, int, int)}.
 * </p>
 */
public final class GridConfig {

    private final int rows;
    private final int cols;
    private final boolean blockerZone;
    private final boolean plantOriginClue;
    private final int minBlockerSize;
    private final int maxBlockerSize;
    private final long seed;
    private final BlockerZone blockerOverride; // nullable

    private GridConfig(Builder b) {
        this.rows = b.rows;
        this.cols = b.cols;
        this.blockerZone = b.blockerZone;
        this.plantOriginClue = b.plantOriginClue;
        this.minBlockerSize = b.minBlockerSize;
        this.maxBlockerSize = b.maxBlockerSize;
        this.seed = b.seed;
        this.blockerOverride = b.blockerOverride;
    }

    public static Builder builder(int rows, int cols) {
        return new Builder(rows, cols);
    }

    public int rows() { return rows; }

    public int cols() { return cols; }

    public Bounds bounds() { return new Bounds(rows, cols); }

    public boolean blockerZone() { return blockerZone; }

    public boolean plantOriginClue() { return plantOriginClue; }

    public int minBlockerSize() { return minBlockerSize; }

    public int maxBlockerSize() { return maxBlockerSize; }

    public long seed() { return seed; }

    public BlockerZone blockerOverride() { return blockerOverride; }

    /** Same geometry settings, different blocker randomness. */
    public GridConfig withSeed(long newSeed) {
        return toBuilder().seed(newSeed).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(rows, cols)
                .blockerZone(blockerZone)
                .plantOriginClue(plantOriginClue)
                .blockerSize(minBlockerSize, maxBlockerSize)
                .seed(seed);
        b.blockerOverride = blockerOverride;
        return b;
    }

    @Override
    public String toString() {
        return "GridConfig{" + rows + "x" + cols
                + ", blocker=" + blockerZone + (blockerOverride != null ? " " + blockerOverride : "")
                + ", originClue=" + plantOriginClue
                + ", blockerSize=" + minBlockerSize + ".." + maxBlockerSize
                + ", seed=" + seed + '}';
    }

    public static final class Builder {
        private final int rows;
        private final int cols;
        private boolean blockerZone = false;
        private boolean plantOriginClue = false;
        private int minBlockerSize = 3;
        private int maxBlockerSize = 6;
        private long seed = 0L;
        private BlockerZone blockerOverride;

        private Builder(int rows, int cols) {
            if (rows < 1 || cols < 1) throw new IllegalArgumentException("grid size must be positive: " + rows + "x" + cols);
            this.rows = rows;
            this.cols = cols;
        }

        public Builder blockerZone(boolean enabled) {
            this.blockerZone = enabled;
            return this;
        }

        public Builder plantOriginClue(boolean plant) {
            this.plantOriginClue = plant;
            return this;
        }

        public Builder blockerSize(int min, int max) {
            if (min < 1 || max < min) throw new IllegalArgumentException("bad blocker size range: " + min + ".." + max);
            this.minBlockerSize = min;
            this.maxBlockerSize = max;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /** Explicit blocker rectangle; implies {@code blockerZone(true)}. */
        public Builder blockerOverride(int row, int col, int height, int width) {
            this.blockerOverride = new BlockerZone(row, col, height, width);
            this.blockerZone = true;
            return this;
        }

        public GridConfig build() {
            return new GridConfig(this);
        }
    }
}
