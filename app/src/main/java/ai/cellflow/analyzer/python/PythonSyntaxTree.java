package ai.cellflow.analyzer.python;

import ai.cellflow.analyzer.ASTTraversalUtils;
import java.nio.charset.StandardCharsets;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * A successfully parsed Python fragment: the tree-sitter tree together with the exact bytes it was parsed from, so
 * identifier nodes can be turned back into names.
 */
public final class PythonSyntaxTree {
    private final TSTree tree;
    private final String source;
    private final byte[] sourceBytes;

    PythonSyntaxTree(TSTree tree, String source) {
        this.tree = tree;
        this.source = source;
        this.sourceBytes = source.getBytes(StandardCharsets.UTF_8);
    }

    public TSNode root() {
        return tree.getRootNode();
    }

    public String source() {
        return source;
    }

    /** The literal text of a node, e.g. the name carried by an identifier. */
    public String text(@Nullable TSNode node) {
        return ASTTraversalUtils.textSlice(node, sourceBytes);
    }

    @Override
    public String toString() {
        return "PythonSyntaxTree[" + root().getType() + ", " + sourceBytes.length + " bytes]";
    }
}
