package ai.cellflow.analyzer.python;

import static org.junit.jupiter.api.Assertions.*;

import ai.cellflow.exception.SourceParseException;
import org.junit.jupiter.api.Test;

public final class PythonParserTest {

    @Test
    void testParsesValidSource() {
        var tree = PythonParser.parse("a = b + 1\n");
        assertEquals("module", tree.root().getType());
        assertEquals("a = b + 1\n", tree.source());
        assertFalse(tree.root().hasError());
    }

    @Test
    void testEmptySourceIsAValidFragment() {
        var tree = PythonParser.parse("");
        assertEquals("module", tree.root().getType());
    }

    @Test
    void testNodeTextUsesByteOffsets() {
        // multi-byte characters before the identifier shift byte offsets away from char offsets
        var tree = PythonParser.parse("s = 'héllo'; n = size\n");
        var identifier = tree.root().getNamedChild(1).getNamedChild(0).getChildByFieldName("right");
        assertEquals("size", tree.text(identifier));
    }

    @Test
    void testRejectsUnbalancedParenthesis() {
        var e = assertThrows(SourceParseException.class, () -> PythonParser.parse("x = (1 +\n"));
        assertTrue(e.getMessage().startsWith("Cannot parse fragment at line "), e.getMessage());
        assertTrue(e.line() >= 1);
    }

    @Test
    void testReportsLineOfFirstError() {
        var e = assertThrows(SourceParseException.class, () -> PythonParser.parse("a = 1\nb = = 2\n"));
        assertEquals(2, e.line());
        assertTrue(e.column() >= 1);
    }

    @Test
    void testRejectsBrokenDefinition() {
        assertThrows(SourceParseException.class, () -> PythonParser.parse("def f(:\n    pass\n"));
    }

    @Test
    void testParserIsReusable() {
        for (int i = 0; i < 5; i++) {
            var tree = PythonParser.parse("x" + i + " = " + i);
            assertEquals("x" + i + " = " + i, tree.source());
        }
    }
}
