package ai.cellflow.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.cellflow.analyzer.python.PythonParser;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public final class ASTTraversalUtilsTest {

    @Test
    void testTextSliceBounds() {
        var bytes = "héllo".getBytes(StandardCharsets.UTF_8);
        assertEquals("héllo", ASTTraversalUtils.textSlice(0, bytes.length, bytes));
        assertEquals("", ASTTraversalUtils.textSlice(2, 2, bytes));
        assertEquals("", ASTTraversalUtils.textSlice(-1, 2, bytes));
        assertEquals("", ASTTraversalUtils.textSlice(10, 12, bytes));
        assertEquals("llo", ASTTraversalUtils.textSlice(3, 99, bytes));
        assertEquals("", ASTTraversalUtils.textSlice(null, bytes));
    }

    @Test
    void testNamedChildrenAndFields() {
        var tree = PythonParser.parse("total = price * qty");
        var assignment = tree.root().getNamedChild(0).getNamedChild(0);
        assertEquals("assignment", assignment.getType());

        var left = ASTTraversalUtils.field(assignment, "left");
        assertNotNull(left);
        assertEquals("total", tree.text(left));
        assertNull(ASTTraversalUtils.field(assignment, "type"));

        var children = ASTTraversalUtils.namedChildren(assignment);
        assertEquals(2, children.size());
        assertTrue(ASTTraversalUtils.namedChildren(null).isEmpty());
    }

    @Test
    void testFindNodeRecursive() {
        var tree = PythonParser.parse("x = f(y)");
        var call = ASTTraversalUtils.findNodeRecursive(tree.root(), n -> "call".equals(n.getType()));
        assertNotNull(call);
        assertEquals("f(y)", tree.text(call));
        assertNull(ASTTraversalUtils.findNodeRecursive(tree.root(), n -> "lambda".equals(n.getType())));
    }
}
