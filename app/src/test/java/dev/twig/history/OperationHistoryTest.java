package dev.twig.history;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class OperationHistoryTest {

    @Test
    public void testPopsNewestFirst() {
        var history = new OperationHistory<String>();
        history.record("a");
        history.record("b");

        assertEquals(Optional.of("b"), history.popUndo());
        assertEquals(Optional.of("a"), history.popUndo());
        assertEquals(Optional.empty(), history.popUndo());
    }

    @Test
    public void testEmptyStacks() {
        var history = new OperationHistory<String>();

        assertFalse(history.hasUndoStates());
        assertFalse(history.hasRedoStates());
        assertTrue(history.popUndo().isEmpty());
        assertTrue(history.popRedo().isEmpty());
    }

    @Test
    public void testRecordDoesNotClearRedo() {
        var history = new OperationHistory<String>();
        history.record("a");
        history.pushRedo(history.popUndo().orElseThrow());
        history.record("b");

        assertEquals(List.of("a"), history.redoEntries());
        assertEquals(List.of("b"), history.undoEntries());
    }

    @Test
    public void testMaxDepthDropsOldest() {
        var history = new OperationHistory<String>(2);
        history.record("a");
        history.record("b");
        history.record("c");

        assertEquals(List.of("b", "c"), history.undoEntries());
    }

    @Test
    public void testNegativeDepthRejected() {
        assertThrows(IllegalArgumentException.class, () -> new OperationHistory<String>(-1));
    }
}
