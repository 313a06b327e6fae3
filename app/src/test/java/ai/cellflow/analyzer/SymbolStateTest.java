package ai.cellflow.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public final class SymbolStateTest {

    @Test
    void testFirstOccurrenceDecides() {
        assertEquals(SymbolState.READ_ONLY, SymbolState.UNSEEN.onRead());
        assertEquals(SymbolState.WRITTEN_ONLY, SymbolState.UNSEEN.onWrite());
        assertEquals(SymbolState.READ_THEN_WRITTEN, SymbolState.READ_ONLY.onWrite());
        // a read after a write is satisfied by the fragment itself
        assertEquals(SymbolState.WRITTEN_ONLY, SymbolState.WRITTEN_ONLY.onRead());
    }

    @Test
    void testReadThenWrittenIsAbsorbing() {
        var state = SymbolState.READ_THEN_WRITTEN;
        assertEquals(state, state.onRead());
        assertEquals(state, state.onWrite());
        assertEquals(state, state.onDeferredRead());
    }

    @Test
    void testDeferredReadAfterWriteStillCounts() {
        assertEquals(SymbolState.READ_THEN_WRITTEN, SymbolState.WRITTEN_ONLY.onDeferredRead());
        assertEquals(SymbolState.READ_ONLY, SymbolState.UNSEEN.onDeferredRead());
        assertEquals(SymbolState.READ_ONLY, SymbolState.READ_ONLY.onDeferredRead());
    }

    @Test
    void testProjections() {
        assertFalse(SymbolState.UNSEEN.isRead());
        assertFalse(SymbolState.UNSEEN.isWritten());
        assertTrue(SymbolState.READ_ONLY.isRead());
        assertFalse(SymbolState.READ_ONLY.isWritten());
        assertFalse(SymbolState.WRITTEN_ONLY.isRead());
        assertTrue(SymbolState.WRITTEN_ONLY.isWritten());
        assertTrue(SymbolState.READ_THEN_WRITTEN.isRead());
        assertTrue(SymbolState.READ_THEN_WRITTEN.isWritten());
    }
}
