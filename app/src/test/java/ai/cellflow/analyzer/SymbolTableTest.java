package ai.cellflow.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public final class SymbolTableTest {

    @Test
    void testUnknownNameIsUnseen() {
        var table = new SymbolTable();
        assertEquals(SymbolState.UNSEEN, table.state("missing"));
        assertTrue(table.snapshot().isEmpty());
    }

    @Test
    void testProjectionsKeepFirstOccurrenceOrder() {
        var table = new SymbolTable();
        table.read("b");
        table.write("a");
        table.read("c");
        table.write("b");
        table.read("a");

        assertEquals(List.of("b", "c"), List.copyOf(table.reads()));
        assertEquals(List.of("b", "a"), List.copyOf(table.writes()));
        assertEquals(SymbolState.WRITTEN_ONLY, table.state("a"));
        assertEquals(SymbolState.READ_THEN_WRITTEN, table.state("b"));
    }

    @Test
    void testDeferredRead() {
        var table = new SymbolTable();
        table.write("e");
        table.deferredRead("e");
        assertEquals(Set.of("e"), table.reads());
        assertEquals(Set.of("e"), table.writes());
    }

    @Test
    void testSnapshotIsDetached() {
        var table = new SymbolTable();
        table.write("x");
        var snapshot = table.snapshot();
        table.read("y");

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("z", SymbolState.READ_ONLY));
    }
}
