package org.calista.grila.crossword.grid;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * UndoStack — journal of grid mutations for multi-step rollback (LIFO).
 *
 * <p>Используется поиском размещения: все шаги одной попытки пишутся сюда,
 * при отказе {@link #rollback()}, при успехе {@link #commit()} (журнал просто забывается).</p>
 */
public final class UndoStack {

    private final Deque<Undo> stack = new ArrayDeque<>();

    public void push(Undo undo) {
        if (undo != null) stack.push(undo);
    }

    /** @return current depth, usable as a mark for {@link #rollbackTo(int)} */
    public int size() {
        return stack.size();
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }

    public void rollback() {
        rollbackTo(0);
    }

    public void rollbackTo(int mark) {
        while (stack.size() > Math.max(0, mark)) stack.pop().undo();
    }

    public void commit() {
        stack.clear();
    }
}
