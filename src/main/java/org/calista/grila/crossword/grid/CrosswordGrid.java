package org.calista.grila.crossword.grid;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * CrosswordGrid — cell matrix with clue licensing and all-or-nothing word commits.
 *
 * <p>
 * Инварианты держатся на каждой мутации, а не только в конце:
 * 1) нет двух ортогонально соседних clue box;
 * 2) нет clue box в правом нижнем углу 2x2;
 * 3) конверсия в clue box не оставляет EMPTY соседа без второго играбельного соседа.
 * Сироты (clue box без лицензий) допустимы временно; их убирает layout completion.
 * </p>
 *
 * <p>Один grid на одну попытку генерации; не потокобезопасен.</p>
 */
public final class CrosswordGrid {

    private static final Logger log = LogManager.getLogger(CrosswordGrid.class);

    private static final int[][] ORTHOGONAL = {{0, 1}, {1, 0}, {0, -1}, {-1, 0}};

    private final GridConfig config;
    private final Bounds bounds;
    private final Cell[][] cells;
    private final Random rng;

    private final Map<String, WordSlot> slots = new LinkedHashMap<>();
    private final SortedMap<GridPos, SortedSet<String>> licenses = new TreeMap<>();

    private BlockerZone blockerZone; // nullable
    private int playableCount;
    private int filledCount;

    public CrosswordGrid(GridConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.bounds = config.bounds();
        this.rng = new Random(config.seed());
        this.cells = new Cell[bounds.rows][bounds.cols];
        for (int r = 0; r < bounds.rows; r++) {
            for (int c = 0; c < bounds.cols; c++) cells[r][c] = new Cell();
        }
        this.playableCount = bounds.area();

        if (config.plantOriginClue()) {
            log.debug("Planting top-left clue box");
            safeAddClueBox(0, 0);
        }
        if (config.blockerZone()) placeBlockerZone();
    }

    // =========================
    // Queries
    // =========================

    public GridConfig config() { return config; }

    public Bounds bounds() { return bounds; }

    public int rows() { return bounds.rows; }

    public int cols() { return bounds.cols; }

    public boolean inBounds(GridPos p) { return bounds.contains(p); }

    public Cell cell(int row, int col) {
        return cells[row][col];
    }

    public Cell cell(GridPos p) {
        return cells[p.row][p.col];
    }

    public boolean isPlayable(GridPos p) {
        return bounds.contains(p) && cell(p).isPlayable();
    }

    public Optional<BlockerZone> blockerZone() {
        return Optional.ofNullable(blockerZone);
    }

    public int playableCount() { return playableCount; }

    public int filledCount() { return filledCount; }

    public double filledRatio() {
        return playableCount == 0 ? 0.0 : (double) filledCount / playableCount;
    }

    public Collection<WordSlot> slots() {
        return Collections.unmodifiableCollection(slots.values());
    }

    public Optional<WordSlot> slot(String id) {
        return Optional.ofNullable(slots.get(id));
    }

    /** Slot ids licensed by the clue box at {@code p}; empty for orphans and non-clue cells. */
    public Set<String> licensesOf(GridPos p) {
        SortedSet<String> s = licenses.get(p);
        return s == null ? Set.of() : Collections.unmodifiableSet(s);
    }

    /** All clue-box positions, row-major. */
    public Set<GridPos> clueBoxes() {
        return Collections.unmodifiableSet(licenses.keySet());
    }

    public List<GridPos> orphanClueBoxes() {
        List<GridPos> out = new ArrayList<>();
        for (Map.Entry<GridPos, SortedSet<String>> e : licenses.entrySet()) {
            if (e.getValue().isEmpty()) out.add(e.getKey());
        }
        return out;
    }

    public List<GridPos> neighbors(GridPos p) {
        List<GridPos> out = new ArrayList<>(4);
        for (int[] d : ORTHOGONAL) {
            GridPos n = p.offset(d[0], d[1]);
            if (bounds.contains(n)) out.add(n);
        }
        return out;
    }

    /** A slot may start here: the previous cell in {@code dir} is outside the grid or blocked. */
    public boolean isBoundary(GridPos p, Direction dir) {
        GridPos prev = dir.step(p, -1);
        return !bounds.contains(prev) || cell(prev).type.isBlocked();
    }

    /** {@code p} is playable and begins a run of at least two playable cells in {@code dir}. */
    public boolean hasCapacityForStart(GridPos p, Direction dir) {
        int length = 0;
        GridPos cur = p;
        while (bounds.contains(cur) && cell(cur).isPlayable()) {
            if (++length >= 2) return true;
            cur = dir.step(cur, 1);
        }
        return false;
    }

    /** Per position: the committed letter or {@code null}. */
    public List<Character> pattern(List<GridPos> positions) {
        List<Character> out = new ArrayList<>(positions.size());
        for (GridPos p : positions) {
            Cell c = cell(p);
            out.add(c.hasLetter() ? c.letter : null);
        }
        return out;
    }

    /** @return the word spelled by {@code positions}, or {@code null} when any cell lacks a letter */
    public String wordAt(List<GridPos> positions) {
        StringBuilder sb = new StringBuilder(positions.size());
        for (GridPos p : positions) {
            Cell c = cell(p);
            if (!c.hasLetter()) return null;
            sb.append(c.letter);
        }
        return sb.toString();
    }

    /** Deep copy of all cells, for cell-by-cell comparison. */
    public Cell[][] snapshotCells() {
        Cell[][] out = new Cell[bounds.rows][bounds.cols];
        for (int r = 0; r < bounds.rows; r++) {
            for (int c = 0; c < bounds.cols; c++) out[r][c] = cells[r][c].copy();
        }
        return out;
    }

    /**
     * Maximal runs of LETTER cells (length &gt;= 2) that begin at a boundary, across first then down.
     */
    public List<SlotSignature> enumerateLetterRuns() {
        List<SlotSignature> out = new ArrayList<>();
        for (Direction dir : Direction.values()) {
            for (int r = 0; r < bounds.rows; r++) {
                for (int c = 0; c < bounds.cols; c++) {
                    GridPos p = GridPos.of(r, c);
                    if (cell(p).type != CellType.LETTER || !isBoundary(p, dir)) continue;
                    List<GridPos> run = new ArrayList<>();
                    GridPos cur = p;
                    while (bounds.contains(cur) && cell(cur).type == CellType.LETTER) {
                        run.add(cur);
                        cur = dir.step(cur, 1);
                    }
                    if (run.size() >= 2) out.add(new SlotSignature(p, dir, run));
                }
            }
        }
        return out;
    }

    // =========================
    // Clue boxes
    // =========================

    public boolean canPlaceClueBox(int row, int col) {
        return clueBoxViolation(row, col) == null;
    }

    public boolean canPlaceClueBox(GridPos p) {
        return canPlaceClueBox(p.row, p.col);
    }

    public void addClueBox(int row, int col) {
        addClueBox(GridPos.of(row, col), null);
    }

    /**
     * Converts an EMPTY cell into an (orphan) clue box.
     *
     * @param journal optional; receives the reversal
     * @throws ClueBoxException when invariants 1-3 or the cell type forbid it
     */
    public void addClueBox(GridPos p, UndoStack journal) {
        String violation = clueBoxViolation(p.row, p.col);
        if (violation != null) throw new ClueBoxException("Cannot place clue box at " + p + ": " + violation);

        Cell cell = cell(p);
        cell.reset(CellType.CLUE_BOX);
        licenses.put(p, new TreeSet<>());
        playableCount--;

        if (journal != null) {
            journal.push(() -> {
                cell.reset(CellType.EMPTY);
                licenses.remove(p);
                playableCount++;
            });
        }
        log.trace("Clue box added at {}", p);
    }

    public GridPos ensureClueBox(int row, int col, Direction dir) {
        return ensureClueBox(GridPos.of(row, col), dir, null);
    }

    /**
     * Licensing clue box for a slot starting at {@code start}: the existing adjacent box with the fewest
     * licenses (first offset wins ties), else a new box at the first offset that accepts one.
     *
     * @throws ClueBoxException when no offset works
     */
    public GridPos ensureClueBox(GridPos start, Direction dir, UndoStack journal) {
        Optional<GridPos> existing = findLicensingClueBox(start, dir);
        if (existing.isPresent()) return existing.get();

        for (GridPos candidate : dir.clueCandidates(start)) {
            if (!bounds.contains(candidate)) continue;
            CellType t = cell(candidate).type;
            if (t == CellType.LETTER || t == CellType.BLOCKER_ZONE) continue;
            if (!canPlaceClueBox(candidate)) continue;
            addClueBox(candidate, journal);
            return candidate;
        }
        throw new ClueBoxException("Unable to license " + dir + " start " + start + " with a valid clue box");
    }

    /** Existing clue box only; never creates one. */
    public Optional<GridPos> findLicensingClueBox(GridPos start, Direction dir) {
        GridPos best = null;
        int bestLicenses = Integer.MAX_VALUE;
        for (GridPos candidate : dir.clueCandidates(start)) {
            if (!bounds.contains(candidate) || !cell(candidate).isClueBox()) continue;
            int n = licensesOf(candidate).size();
            if (n < bestLicenses) {
                best = candidate;
                bestLicenses = n;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Reassigns the licensing of {@code slotId} to the clue box at {@code newBox} and moves its hosted clue
     * records there, rewriting their offsets.
     */
    public void moveSlotToClue(String slotId, GridPos newBox) {
        WordSlot slot = slots.get(slotId);
        if (slot == null) throw new IllegalArgumentException("Unknown slot: " + slotId);
        if (!bounds.contains(newBox) || !cell(newBox).isClueBox()) {
            throw new ClueBoxException("Not a clue box: " + newBox);
        }
        if (!slot.direction().isClueOffset(slot.start(), newBox)) {
            throw new ClueBoxException("Clue box " + newBox + " cannot license " + slot);
        }

        GridPos oldBox = slot.clueBox();
        if (oldBox.equals(newBox)) return;

        SortedSet<String> oldLicenses = licenses.get(oldBox);
        if (oldLicenses != null) oldLicenses.remove(slotId);
        licenses.computeIfAbsent(newBox, k -> new TreeSet<>()).add(slotId);

        Cell from = cell(oldBox);
        Cell to = cell(newBox);
        Iterator<Clue> it = from.clues.iterator();
        while (it.hasNext()) {
            Clue clue = it.next();
            if (!clue.slotId().equals(slotId)) continue;
            it.remove();
            to.clues.add(clue.withOffset(slot.start().row - newBox.row, slot.start().col - newBox.col));
        }
        slot.clueBox(newBox);
        log.debug("Slot {} moved from clue box {} to {}", slotId, oldBox, newBox);
    }

    public void hostClue(GridPos box, Clue clue, UndoStack journal) {
        Objects.requireNonNull(clue, "clue");
        if (!bounds.contains(box) || !cell(box).isClueBox()) {
            throw new ClueBoxException("Cannot host clue outside a clue box: " + box);
        }
        Cell cell = cell(box);
        cell.clues.add(clue);
        if (journal != null) {
            journal.push(() -> cell.clues.remove(clue));
        }
    }

    public void clearHostedClues() {
        for (GridPos p : licenses.keySet()) cell(p).clues.clear();
    }

    // =========================
    // Words
    // =========================

    public void placeWord(WordSlot slot, String text) {
        placeWordUndoable(slot, text);
    }

    /**
     * All-or-nothing commit: every cell must be playable and either empty or holding the same letter.
     *
     * @return reversal restoring the cells, counters, licensing and slot registry
     * @throws PlacementException on any violation; the grid is untouched then
     */
    public Undo placeWordUndoable(WordSlot slot, String text) {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(text, "text");
        String word = text.toUpperCase(Locale.ROOT);

        if (word.length() != slot.length()) {
            throw new PlacementException("Word length mismatch: " + word + " for " + slot);
        }
        if (slots.containsKey(slot.id())) {
            throw new PlacementException("Slot id already placed: " + slot.id());
        }
        GridPos box = slot.clueBox();
        if (!bounds.contains(box) || !cell(box).isClueBox() || !slot.direction().isClueOffset(slot.start(), box)) {
            throw new PlacementException("Slot " + slot.id() + " is not licensed by a clue box at " + box);
        }

        List<GridPos> positions = slot.cells();
        CellType[] oldTypes = new CellType[positions.size()];
        char[] oldLetters = new char[positions.size()];
        for (int i = 0; i < positions.size(); i++) {
            GridPos p = positions.get(i);
            if (!bounds.contains(p)) throw new PlacementException("Word extends outside grid: " + slot);
            Cell cell = cell(p);
            if (cell.type.isBlocked()) throw new PlacementException("Word overlaps blocked cell " + p);
            if (cell.hasLetter() && cell.letter != word.charAt(i)) {
                throw new PlacementException("Letter conflict at " + p + ": " + cell.letter + " vs " + word.charAt(i));
            }
            oldTypes[i] = cell.type;
            oldLetters[i] = cell.letter;
        }

        int newlyFilled = 0;
        for (int i = 0; i < positions.size(); i++) {
            Cell cell = cell(positions.get(i));
            if (cell.type == CellType.EMPTY) newlyFilled++;
            cell.type = CellType.LETTER;
            cell.letter = word.charAt(i);
            cell.slotIds.add(slot.id());
        }
        filledCount += newlyFilled;
        slot.text(word);
        slots.put(slot.id(), slot);
        licenses.computeIfAbsent(box, k -> new TreeSet<>()).add(slot.id());

        final int filled = newlyFilled;
        return () -> {
            for (int i = 0; i < positions.size(); i++) {
                Cell cell = cell(positions.get(i));
                cell.slotIds.remove(slot.id());
                if (cell.slotIds.isEmpty()) {
                    cell.type = oldTypes[i];
                    cell.letter = oldLetters[i];
                }
            }
            filledCount -= filled;
            SortedSet<String> l = licenses.get(slot.clueBox());
            if (l != null) l.remove(slot.id());
            slots.remove(slot.id());
            slot.text(null);
        };
    }

    /** Removes a committed word; cells owned by no other slot become EMPTY again. Unknown ids are ignored. */
    public void removeWord(String slotId) {
        WordSlot slot = slots.remove(slotId);
        if (slot == null) return;
        for (GridPos p : slot.cells()) {
            Cell cell = cell(p);
            cell.slotIds.remove(slotId);
            if (cell.slotIds.isEmpty() && cell.type == CellType.LETTER) {
                cell.type = CellType.EMPTY;
                cell.letter = Cell.NO_LETTER;
                filledCount--;
            }
        }
        SortedSet<String> l = licenses.get(slot.clueBox());
        if (l != null) l.remove(slotId);
        if (bounds.contains(slot.clueBox())) cell(slot.clueBox()).clues.removeIf(c -> c.slotId().equals(slotId));
        slot.text(null);
    }

    /**
     * Makes the cell after a committed word a boundary.
     *
     * <ul>
     *   <li>next cell outside the grid or in the blocker zone: nothing to do;</li>
     *   <li>next cell holds a letter: {@link PlacementException};</li>
     *   <li>fewer than two playable cells after the next cell: no clue is forced;</li>
     *   <li>otherwise the next cell becomes a clue box (if it is not one already).</li>
     * </ul>
     *
     * @return the start of a follow-up slot after the new boundary, when that cell is EMPTY
     */
    public Optional<GridPos> ensureTerminalBoundary(WordSlot slot, UndoStack journal) {
        Direction dir = slot.direction();
        GridPos next = dir.step(slot.end(), 1);
        if (!bounds.contains(next)) return Optional.empty();

        Cell nextCell = cell(next);
        if (nextCell.type == CellType.BLOCKER_ZONE) return Optional.empty();
        if (nextCell.type == CellType.LETTER) {
            throw new PlacementException("Word " + slot.id() + " collides with another slot at terminal cell " + next);
        }

        GridPos followStart = dir.step(next, 1);
        if (!hasCapacityForStart(followStart, dir)) return Optional.empty();

        if (!nextCell.isClueBox()) addClueBox(next, journal);

        if (bounds.contains(followStart) && cell(followStart).isEmpty()) return Optional.of(followStart);
        return Optional.empty();
    }

    // =========================
    // Blocker zone
    // =========================

    /** Idempotent; size and anchor come from the grid's seeded RNG unless overridden in the config. */
    public void placeBlockerZone() {
        if (blockerZone != null) return;

        BlockerZone zone = config.blockerOverride();
        if (zone == null) {
            int maxH = Math.min(config.maxBlockerSize(), Math.max(3, bounds.rows / 2));
            int maxW = Math.min(config.maxBlockerSize(), Math.max(3, bounds.cols / 2));
            int minH = Math.min(config.minBlockerSize(), maxH);
            int minW = Math.min(config.minBlockerSize(), maxW);
            int height = minH + rng.nextInt(maxH - minH + 1);
            int width = minW + rng.nextInt(maxW - minW + 1);
            if (height >= bounds.rows || width >= bounds.cols) {
                log.warn("Grid {} too small for a {}x{} blocker zone, skipping", bounds, height, width);
                return;
            }
            int[][] anchors = {
                    {0, 0},
                    {0, bounds.cols - width},
                    {bounds.rows - height, 0},
                    {bounds.rows - height, bounds.cols - width},
                    {(bounds.rows - height) / 2, (bounds.cols - width) / 2}
            };
            int[] a = anchors[rng.nextInt(anchors.length)];
            zone = new BlockerZone(a[0], a[1], height, width);
        }

        log.debug("Placing blocker zone at {}", zone);
        int rowEnd = Math.min(zone.row + zone.height, bounds.rows);
        int colEnd = Math.min(zone.col + zone.width, bounds.cols);
        for (int r = Math.max(0, zone.row); r < rowEnd; r++) {
            for (int c = Math.max(0, zone.col); c < colEnd; c++) carveBlocker(GridPos.of(r, c));
        }
        blockerZone = zone;

        if (zone.anchoredAtOrigin()) {
            // re-entrant corners of the remaining L-shaped region
            if (zone.width < bounds.cols) safeAddClueBox(0, zone.width);
            if (zone.height < bounds.rows) safeAddClueBox(zone.height, 0);
        }
    }

    private void carveBlocker(GridPos p) {
        Cell cell = cell(p);
        if (cell.isPlayable()) playableCount--;
        if (cell.type == CellType.LETTER) filledCount--;
        cell.reset(CellType.BLOCKER_ZONE);
        licenses.remove(p);
    }

    private void safeAddClueBox(int row, int col) {
        try {
            addClueBox(row, col);
        } catch (ClueBoxException e) {
            log.warn("Failed to add auto clue box at ({},{}): {}", row, col, e.getMessage());
        }
    }

    // =========================
    // Internals
    // =========================

    /** @return reason the cell cannot become a clue box, {@code null} if it can */
    private String clueBoxViolation(int row, int col) {
        if (!bounds.contains(row, col)) return "outside bounds";
        Cell cell = cells[row][col];
        if (cell.type != CellType.EMPTY) return "cell is " + cell.type;
        if (bounds.inBottomRightCorner(row, col)) return "bottom-right corner";

        for (int[] d : ORTHOGONAL) {
            int nr = row + d[0], nc = col + d[1];
            if (bounds.contains(nr, nc) && cells[nr][nc].type == CellType.CLUE_BOX) {
                return "adjacent clue box at (" + nr + "," + nc + ")";
            }
        }

        // every EMPTY neighbour must keep another playable neighbour
        for (int[] d : ORTHOGONAL) {
            int nr = row + d[0], nc = col + d[1];
            if (!bounds.contains(nr, nc) || cells[nr][nc].type != CellType.EMPTY) continue;
            boolean keeps = false;
            for (int[] d2 : ORTHOGONAL) {
                int r2 = nr + d2[0], c2 = nc + d2[1];
                if (r2 == row && c2 == col) continue;
                if (bounds.contains(r2, c2) && cells[r2][c2].isPlayable()) {
                    keeps = true;
                    break;
                }
            }
            if (!keeps) return "would isolate (" + nr + "," + nc + ")";
        }
        return null;
    }
}
