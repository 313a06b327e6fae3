package ai.cellflow.analyzer.python;

import ai.cellflow.analyzer.ASTTraversalUtils;
import ai.cellflow.exception.SourceParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterPython;

/** Parses Python source text with tree-sitter. Safe to call from several threads; each uses its own parser. */
public final class PythonParser {
    private static final Logger log = LogManager.getLogger(PythonParser.class);

    private static final ThreadLocal<TSLanguage> threadLocalLanguage = ThreadLocal.withInitial(TreeSitterPython::new);
    private static final ThreadLocal<TSParser> threadLocalParser = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        if (!parser.setLanguage(threadLocalLanguage.get())) {
            log.error("Failed to set language on TSParser for {}", TreeSitterPython.class.getSimpleName());
        }
        return parser;
    });

    private PythonParser() {}

    /**
     * Parses one fragment.
     *
     * @throws SourceParseException if the text is not valid Python; tree-sitter recovers from syntax errors, so any
     *     {@code ERROR} or missing node in the tree counts as a rejection
     */
    public static PythonSyntaxTree parse(String source) {
        var tree = threadLocalParser.get().parseString(null, source);
        var syntaxTree = new PythonSyntaxTree(tree, source);
        var root = syntaxTree.root();
        if (root.isNull()) {
            throw new SourceParseException("parser produced no tree", 1, 1);
        }
        if (root.hasError()) {
            var offending = ASTTraversalUtils.findNodeRecursive(
                    root, node -> PythonTreeSitterNodeTypes.ERROR.equals(node.getType()) || node.isMissing());
            throw rejection(syntaxTree, offending == null ? root : offending);
        }
        log.trace("Parsed fragment into {}", syntaxTree);
        return syntaxTree;
    }

    private static SourceParseException rejection(PythonSyntaxTree tree, TSNode node) {
        var point = node.getStartPoint();
        String reason;
        if (node.isMissing()) {
            reason = "missing " + node.getType();
        } else {
            var text = tree.text(node).strip();
            reason = text.isEmpty() ? "unexpected end of input" : "unexpected '" + abbreviate(text) + "'";
        }
        log.debug("Rejecting fragment: {} at {}:{}", reason, point.getRow() + 1, point.getColumn() + 1);
        return new SourceParseException(reason, point.getRow() + 1, point.getColumn() + 1);
    }

    private static String abbreviate(String text) {
        var firstLine = text.lines().findFirst().orElse("");
        return firstLine.length() > 40 ? firstLine.substring(0, 40) + "..." : firstLine;
    }
}
