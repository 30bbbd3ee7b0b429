package org.calista.grila.crossword.layout;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.dictionary.WordIndex;
import org.calista.grila.crossword.grid.*;

import java.util.*;

/**
 * LayoutCompleter — turns a grid with seeded words into a fillable slot structure.
 *
 * <p>
 * Passes, in order:
 * 1) heal isolated EMPTY cells;
 * 2) partition long runs (coarse threshold, then fine), healing after each change;
 * 3) license every run start (or sacrifice the start cell), to a fixed point;
 * 4) let orphan clue boxes adopt slots from over-licensed boxes;
 * 5) verify every open run of length 3+ is still satisfiable.
 * </p>
 */
public final class LayoutCompleter {

    private static final Logger log = LogManager.getLogger(LayoutCompleter.class);

    // =========================
    // Config
    // =========================

    public static final class Config {
        /** Run-length ceilings applied in order. */
        public int[] partitionThresholds = {10, 8};
        /** Safety cap per threshold. */
        public int partitionIterations = 30;
        /** Infeasible runs up to this length get one partition repair. */
        public int shortRepairMaxLength = 4;

        public Config validate() {
            if (partitionThresholds == null || partitionThresholds.length == 0) partitionThresholds = new int[]{10, 8};
            for (int i = 0; i < partitionThresholds.length; i++) {
                if (partitionThresholds[i] < 4) partitionThresholds[i] = 4;
            }
            if (partitionIterations < 1) partitionIterations = 1;
            if (shortRepairMaxLength < 0) shortRepairMaxLength = 0;
            return this;
        }
    }

    private final WordIndex index;
    private final Config cfg;

    public LayoutCompleter(WordIndex index, Config cfg) {
        this.index = Objects.requireNonNull(index, "index");
        this.cfg = (cfg == null ? new Config() : cfg).validate();
    }

    /**
     * Runs all passes.
     *
     * @throws LayoutException when healing fails or a run is infeasible
     */
    public Report complete(CrosswordGrid grid, PlacementLedger ledger) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(ledger, "ledger");

        Report report = new Report();
        report.healed += healIsolatedCells(grid);

        for (int threshold : cfg.partitionThresholds) {
            for (int i = 0; i < cfg.partitionIterations; i++) {
                if (!partitionLongRuns(grid, threshold)) break;
                report.partitions++;
                report.healed += healIsolatedCells(grid);
            }
        }

        report.licensed = ensureAllLicensed(grid);
        report.adopted = repairOrphanClues(grid);
        report.repairs = verifyFeasibility(grid, ledger);

        log.debug("Layout completed: {}", report);
        return report;
    }

    // ---------------------------------------------------------------------
    // 1) healing
    // ---------------------------------------------------------------------

    /**
     * Converts every EMPTY cell without a playable orthogonal neighbour into a clue box.
     *
     * @return number of healed cells
     * @throws LayoutException when such a cell cannot become a clue box
     */
    public int healIsolatedCells(CrosswordGrid grid) {
        int healed = 0;
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                GridPos p = GridPos.of(r, c);
                if (!grid.cell(p).isEmpty()) continue;

                boolean hasPlayable = false;
                for (GridPos n : grid.neighbors(p)) {
                    if (grid.cell(n).isPlayable()) {
                        hasPlayable = true;
                        break;
                    }
                }
                if (hasPlayable) continue;

                try {
                    grid.addClueBox(p, null);
                    healed++;
                    log.debug("Healed isolated cell at {}", p);
                } catch (ClueBoxException e) {
                    throw new LayoutException("Isolated cell at " + p + " cannot be healed", e);
                }
            }
        }
        return healed;
    }

    // ---------------------------------------------------------------------
    // 2) partitioning
    // ---------------------------------------------------------------------

    /**
     * Cuts every not-yet-filled run longer than {@code maxLen} with one clue box near its midpoint.
     * Cuts leaving a 3-cell remainder on either side are penalized.
     *
     * @return whether any cut was made
     */
    public boolean partitionLongRuns(CrosswordGrid grid, int maxLen) {
        boolean changed = false;
        for (Direction dir : Direction.values()) {
            for (int r = 0; r < grid.rows(); r++) {
                for (int c = 0; c < grid.cols(); c++) {
                    GridPos p = GridPos.of(r, c);
                    if (!grid.cell(p).isPlayable() || !grid.isBoundary(p, dir)) continue;

                    Optional<SlotSignature> sig = SlotScanner.signatureThrough(grid, p, dir);
                    if (sig.isEmpty() || sig.get().length() <= maxLen) continue;
                    if (SlotScanner.isFullyFilled(grid, sig.get())) continue;

                    for (int offset : cutOrder(sig.get().length())) {
                        GridPos cut = sig.get().cells().get(offset);
                        if (!grid.cell(cut).isEmpty() || !grid.canPlaceClueBox(cut)) continue;
                        grid.addClueBox(cut, null);
                        log.debug("Partitioned {} run {} len={} at {}", dir, p, sig.get().length(), cut);
                        changed = true;
                        break;
                    }
                }
            }
        }
        return changed;
    }

    /** Interior offsets 2..len-2 by |x - len/2| + 10 per side left with exactly 3 cells; stable on ties. */
    static List<Integer> cutOrder(int length) {
        int mid = length / 2;
        List<Integer> offsets = new ArrayList<>();
        for (int x = 2; x < length - 1; x++) offsets.add(x);
        offsets.sort(Comparator.comparingInt(x -> {
            int penalty = 0;
            if (x == 3) penalty += 10;
            if (length - x - 1 == 3) penalty += 10;
            return Math.abs(x - mid) + penalty;
        }));
        return offsets;
    }

    // ---------------------------------------------------------------------
    // 3) licensing
    // ---------------------------------------------------------------------

    /**
     * Repeats until no change: every run start gets an adjacent clue box; a start that cannot be licensed
     * is itself turned into a clue box when it is still EMPTY.
     *
     * @return number of clue boxes created
     */
    public int ensureAllLicensed(CrosswordGrid grid) {
        int created = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Direction dir : Direction.values()) {
                for (int r = 0; r < grid.rows(); r++) {
                    for (int c = 0; c < grid.cols(); c++) {
                        GridPos p = GridPos.of(r, c);
                        if (!grid.cell(p).isPlayable() || !grid.isBoundary(p, dir)) continue;
                        if (SlotScanner.signatureThrough(grid, p, dir).isEmpty()) continue;
                        if (SlotScanner.hasAdjacentClue(grid, p, dir)) continue;

                        try {
                            grid.ensureClueBox(p, dir, null);
                            created++;
                            changed = true;
                        } catch (ClueBoxException e) {
                            if (grid.cell(p).isEmpty() && grid.canPlaceClueBox(p)) {
                                grid.addClueBox(p, null);
                                created++;
                                changed = true;
                                log.debug("Eliminated unlicensable {} start at {}", dir, p);
                            } else {
                                log.debug("Cannot resolve unlicensable {} start at {}: {}", dir, p, e.getMessage());
                            }
                        }
                    }
                }
            }
            if (changed) healIsolatedCells(grid);
        }
        return created;
    }

    // ---------------------------------------------------------------------
    // 4) orphans
    // ---------------------------------------------------------------------

    /**
     * Each orphan clue box adopts the first registered slot it may license whose current box licenses
     * more than one slot.
     *
     * @return number of adopted slots
     */
    public int repairOrphanClues(CrosswordGrid grid) {
        int adopted = 0;
        for (GridPos orphan : grid.orphanClueBoxes()) {
            for (WordSlot slot : new ArrayList<>(grid.slots())) {
                if (!slot.direction().isClueOffset(slot.start(), orphan)) continue;
                if (grid.licensesOf(slot.clueBox()).size() <= 1) continue;
                grid.moveSlotToClue(slot.id(), orphan);
                adopted++;
                break;
            }
        }
        return adopted;
    }

    // ---------------------------------------------------------------------
    // 5) feasibility
    // ---------------------------------------------------------------------

    /**
     * Every open run of length 3+ is either a complete dictionary/theme word or has a candidate
     * (used words excluded). Short infeasible runs get one partition repair.
     *
     * @return number of partition repairs
     * @throws LayoutException on an invalid complete word or an unrepairable infeasible run
     */
    public int verifyFeasibility(CrosswordGrid grid, PlacementLedger ledger) {
        int repairs = 0;
        for (SlotSignature sig : SlotScanner.openRuns(grid, ledger)) {
            if (sig.length() < 3) continue;

            String word = grid.wordAt(sig.cells());
            if (word != null) {
                if (ledger.themeSurfaces().contains(word) || index.contains(word)) continue;
                throw new LayoutException("Pre-filled invalid word '" + word + "' at " + sig.start());
            }

            List<Character> pattern = grid.pattern(sig.cells());
            if (index.hasCandidates(sig.length(), pattern, ledger.usedWords())) continue;

            if (sig.length() <= cfg.shortRepairMaxLength && partitionInfeasible(grid, sig)) {
                repairs++;
                continue;
            }
            throw new LayoutException("Infeasible slot at " + sig.start() + " " + sig.direction() + " len=" + sig.length());
        }
        return repairs;
    }

    private boolean partitionInfeasible(CrosswordGrid grid, SlotSignature sig) {
        for (int offset = 1; offset < sig.length(); offset++) {
            GridPos cut = sig.cells().get(offset);
            if (!grid.cell(cut).isEmpty() || !grid.canPlaceClueBox(cut)) continue;
            grid.addClueBox(cut, null);
            log.debug("Partitioned infeasible slot at {} with clue at {}", sig.start(), cut);
            return true;
        }
        return false;
    }

    // =========================
    // Report
    // =========================

    public static final class Report {
        public int healed;
        public int partitions;
        public int licensed;
        public int adopted;
        public int repairs;

        @Override
        public String toString() {
            return "healed=" + healed + ", partitions=" + partitions + ", licensed=" + licensed
                    + ", adopted=" + adopted + ", repairs=" + repairs;
        }
    }
}
