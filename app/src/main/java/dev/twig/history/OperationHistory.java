package dev.twig.history;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Undo/redo stacks of tagged operation records for one owner (a branch or a repository). The newest entry of each
 * stack is at its tail.
 *
 * <p>The owner decides what an entry means: it pops an entry, reverses or re-applies it, and re-files it on the
 * opposite stack with {@link #pushRedo} or {@link #pushUndo}. Recording a new operation leaves the redo stack as it
 * is, so an entry undone before a fresh mutation can still be redone afterwards.
 *
 * <p>Not thread-safe. The owner confines all access to a single writer.
 *
 * @param <T> the owner's closed operation type
 */
public class OperationHistory<T> {
    private static final Logger logger = LogManager.getLogger(OperationHistory.class);

    private final Deque<T> undo = new ArrayDeque<>();
    private final Deque<T> redo = new ArrayDeque<>();

    /** {@code 0} means unbounded. */
    private final int maxDepth;

    public OperationHistory() {
        this(0);
    }

    public OperationHistory(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /* ───────────────────────── recording ─────────────────────────── */

    /** Records a freshly performed operation. */
    public void record(T op) {
        pushUndo(op);
    }

    public void pushUndo(T op) {
        undo.addLast(op);
        truncate();
    }

    public void pushRedo(T op) {
        redo.addLast(op);
    }

    /* ───────────────────────── popping ─────────────────────────── */

    public Optional<T> popUndo() {
        return Optional.ofNullable(undo.pollLast());
    }

    public Optional<T> popRedo() {
        return Optional.ofNullable(redo.pollLast());
    }

    /* ───────────────────────── inspection ─────────────────────────── */

    public boolean hasUndoStates() {
        return !undo.isEmpty();
    }

    public boolean hasRedoStates() {
        return !redo.isEmpty();
    }

    /** Immutable view (oldest → newest). */
    public List<T> undoEntries() {
        return List.copyOf(undo);
    }

    /** Immutable view (oldest → newest). */
    public List<T> redoEntries() {
        return List.copyOf(redo);
    }

    public int maxDepth() {
        return maxDepth;
    }

    private void truncate() {
        if (maxDepth == 0) {
            return;
        }
        while (undo.size() > maxDepth) {
            var removed = undo.removeFirst();
            logger.debug("Truncated undo history (dropped oldest entry: {})", removed);
        }
    }
}
