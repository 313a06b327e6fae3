package ai.cellflow.flow;

import static org.junit.jupiter.api.Assertions.*;

import ai.cellflow.analyzer.SymbolState;
import ai.cellflow.analyzer.python.PythonParser;
import ai.cellflow.exception.SourceParseException;
import ai.cellflow.util.FlowSettings;
import java.util.Set;
import org.junit.jupiter.api.Test;

public final class FragmentTest {

    private static Fragment parse(String source) {
        return Fragment.parse(source, FlowSettings.defaults());
    }

    @Test
    void testReadsAndWrites() {
        var fragment = parse("""
                a = b + 1; c = 4; del d; e = 1
                def f(g):
                    h = i + 6; print(e)
                """);
        assertEquals(Set.of("b", "d", "i", "e"), fragment.reads());
        assertEquals(Set.of("a", "c", "d", "e", "f"), fragment.writes());
    }

    @Test
    void testCompoundStatementAfterSemicolonIsRejected() {
        var e = assertThrows(
                SourceParseException.class,
                () -> parse("a = b + 1; c = 4; del d; e = 1; def f(g): h = i + 6; print(e)"));
        assertEquals(1, e.line());
    }

    @Test
    void testAllReadsKeepBuiltins() {
        var fragment = parse("total = sum(values)\nprint(total)");
        assertEquals(Set.of("values"), fragment.reads());
        assertEquals(Set.of("sum", "values", "print"), fragment.allReads());
    }

    @Test
    void testMultilineCell() {
        var fragment = parse("""
                a = b + 1
                c = 4
                del d
                e = 1
                def f(g):
                    h = i + 6
                del c
                """);
        assertEquals(Set.of("b", "d", "i"), fragment.reads());
        assertEquals(Set.of("a", "c", "d", "e", "f"), fragment.writes());
    }

    @Test
    void testSymbolsKeepBuiltins() {
        var fragment = parse("print(x)");
        assertEquals(Set.of("x"), fragment.reads());
        assertEquals(SymbolState.READ_ONLY, fragment.symbols().get("print"));
    }

    @Test
    void testBuiltinReadsCanBeKept() {
        var settings = FlowSettings.defaults().withIgnoreBuiltinReads(false);
        var fragment = Fragment.parse("n = len(items)", settings);
        assertEquals(Set.of("len", "items"), fragment.reads());
    }

    @Test
    void testShadowedBuiltinIsStillWritten() {
        var fragment = parse("list = [1, 2]\nprint(list)");
        assertEquals(Set.of("list"), fragment.writes());
        assertEquals(Set.of(), fragment.reads());
    }

    @Test
    void testParseErrorCreatesNoFragment() {
        assertThrows(SourceParseException.class, () -> parse("def broken(:"));
    }

    @Test
    void testFromParsedTree() {
        var tree = PythonParser.parse("y = x * 2");
        var fragment = Fragment.of(tree, FlowSettings.defaults());
        assertSame(tree, fragment.tree());
        assertEquals("y = x * 2", fragment.source());
        assertEquals(Set.of("x"), fragment.reads());
        assertEquals(Set.of("y"), fragment.writes());
    }

    @Test
    void testClassificationIsDeterministic() {
        var source = "for k in keys:\n    table[k] = f(k)\n";
        var first = parse(source);
        var second = parse(source);
        assertEquals(first.reads(), second.reads());
        assertEquals(first.writes(), second.writes());
        assertEquals(first.symbols(), second.symbols());
    }

    @Test
    void testIdentityEquality() {
        var first = parse("x = 1");
        var second = parse("x = 1");
        assertNotEquals(first, second);
        assertEquals(first, first);
    }

    @Test
    void testSetsAreUnmodifiable() {
        var fragment = parse("x = y");
        assertThrows(UnsupportedOperationException.class, () -> fragment.reads().add("z"));
        assertThrows(UnsupportedOperationException.class, () -> fragment.writes().clear());
    }

    @Test
    void testToStringShowsFirstLine() {
        var fragment = parse("\nresult = compute_something_quite_long(argument_one, argument_two)\nother = 1\n");
        assertEquals("Fragment[result = compute_something_quite_long(ar...]", fragment.toString());
    }
}
