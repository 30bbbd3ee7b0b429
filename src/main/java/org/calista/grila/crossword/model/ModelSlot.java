package org.calista.grila.crossword.model;

import org.calista.grila.crossword.grid.Direction;
import org.calista.grila.crossword.grid.GridPos;
import org.calista.grila.crossword.grid.SlotSignature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An open run inside the model: its geometry, licensing clue box and one term per cell.
 */
public final class ModelSlot {

    private final SlotSignature signature;
    private final GridPos clueBox;
    private final List<Term> terms;
    private final int candidates;

    ModelSlot(SlotSignature signature, GridPos clueBox, List<Term> terms, int candidates) {
        this.signature = signature;
        this.clueBox = clueBox;
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
        this.candidates = candidates;
    }

    public String key() { return signature.key(); }

    public SlotSignature signature() { return signature; }

    public GridPos start() { return signature.start(); }

    public Direction direction() { return signature.direction(); }

    public int length() { return signature.length(); }

    public GridPos clueBox() { return clueBox; }

    public List<Term> terms() { return terms; }

    /** Size of the candidate table installed for this slot. */
    public int candidates() { return candidates; }

    public boolean hasVariables() {
        for (Term t : terms) {
            if (t.isVariable()) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return key() + " clue=" + clueBox + " candidates=" + candidates;
    }
}
