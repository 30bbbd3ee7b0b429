package org.calista.grila.crossword.layout;

import org.calista.grila.crossword.grid.CrosswordGrid;
import org.calista.grila.crossword.grid.Direction;
import org.calista.grila.crossword.grid.GridPos;
import org.calista.grila.crossword.grid.SlotSignature;
import org.calista.grila.crossword.grid.WordSlot;

import java.util.*;

/**
 * PlacementLedger — per-attempt bookkeeping owned by one generation attempt.
 *
 * <p>
 * Slot id counter, occupied run keys, used words, theme surfaces and the pending-start queue.
 * Никакого глобального состояния: новая попытка = новый ledger.
 * </p>
 */
public final class PlacementLedger {

    private int slotCounter;
    private long pendingCounter;

    private final Set<String> occupied = new HashSet<>();
    private final Set<String> usedWords = new LinkedHashSet<>();
    private final Set<String> themeSurfaces = new LinkedHashSet<>();
    private final PriorityQueue<PendingStart> pending = new PriorityQueue<>();

    // ---------------------------------------------------------------------
    // Slots
    // ---------------------------------------------------------------------

    /** A0001, D0002, ... one counter shared by both directions. */
    public String nextSlotId(Direction dir) {
        slotCounter++;
        return String.format("%s%04d", dir == Direction.ACROSS ? "A" : "D", slotCounter);
    }

    public void register(WordSlot slot) {
        occupied.add(slot.key());
    }

    public boolean isOccupied(String key) {
        return occupied.contains(key);
    }

    // ---------------------------------------------------------------------
    // Words
    // ---------------------------------------------------------------------

    public void markUsed(String word) {
        usedWords.add(word);
    }

    public Set<String> usedWords() {
        return Collections.unmodifiableSet(usedWords);
    }

    public void addThemeSurface(String surface) {
        themeSurfaces.add(surface);
    }

    public Set<String> themeSurfaces() {
        return Collections.unmodifiableSet(themeSurfaces);
    }

    // ---------------------------------------------------------------------
    // Pending starts
    // ---------------------------------------------------------------------

    /**
     * Queues the run through {@code start} unless it is shorter than 2 or already fully filled.
     * Priority {@code -(filled*10) + openness}: smaller first, FIFO among equals.
     */
    public void queueStart(CrosswordGrid grid, GridPos start, Direction dir) {
        Optional<SlotSignature> sig = SlotScanner.signatureThrough(grid, start, dir);
        if (sig.isEmpty()) return;

        int filled = 0;
        for (Character ch : grid.pattern(sig.get().cells())) {
            if (ch != null) filled++;
        }
        int length = sig.get().length();
        if (filled == length) return;

        int openness = length - filled;
        pending.add(new PendingStart(-(filled * 10) + openness, pendingCounter++, sig.get().start(), dir));
    }

    public Optional<PendingStart> pollPending() {
        return Optional.ofNullable(pending.poll());
    }

    public static final class PendingStart implements Comparable<PendingStart> {
        public final int priority;
        public final long order;
        public final GridPos start;
        public final Direction direction;

        PendingStart(int priority, long order, GridPos start, Direction direction) {
            this.priority = priority;
            this.order = order;
            this.start = start;
            this.direction = direction;
        }

        @Override
        public int compareTo(PendingStart o) {
            int c = Integer.compare(priority, o.priority);
            return c != 0 ? c : Long.compare(order, o.order);
        }

        @Override
        public String toString() {
            return start + " " + direction + " p=" + priority;
        }
    }
}
