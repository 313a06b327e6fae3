package ai.cellflow.analyzer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Tree-sitter traversal helpers shared by the parser front end and the symbol classifier. */
public final class ASTTraversalUtils {
    private static final Logger log = LogManager.getLogger(ASTTraversalUtils.class);

    private ASTTraversalUtils() {}

    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /** Returns the node for {@code fieldName}, or null when the field is absent. */
    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    /** Named children in source order. Anonymous tokens (keywords, punctuation) are skipped. */
    public static List<TSNode> namedChildren(@Nullable TSNode node) {
        if (!isPresent(node)) {
            return List.of();
        }
        var count = node.getNamedChildCount();
        var children = new ArrayList<TSNode>(count);
        for (int i = 0; i < count; i++) {
            var child = node.getNamedChild(i);
            if (isPresent(child)) {
                children.add(child);
            }
        }
        return children;
    }

    /** Recursively finds the first node (pre-order, all children) matching the given predicate. */
    public static @Nullable TSNode findNodeRecursive(@Nullable TSNode rootNode, Predicate<TSNode> predicate) {
        if (!isPresent(rootNode)) {
            return null;
        }

        if (predicate.test(rootNode)) {
            return rootNode;
        }

        for (int i = 0; i < rootNode.getChildCount(); i++) {
            var child = rootNode.getChild(i);
            if (isPresent(child)) {
                var result = findNodeRecursive(child, predicate);
                if (result != null) {
                    return result;
                }
            }
        }

        return null;
    }

    /** Extracts the text of a node from the UTF-8 bytes it was parsed from. */
    public static String textSlice(@Nullable TSNode node, byte[] srcBytes) {
        if (!isPresent(node)) {
            return "";
        }
        return textSlice(node.getStartByte(), node.getEndByte(), srcBytes);
    }

    public static String textSlice(int startByte, int endByte, byte[] srcBytes) {
        if (startByte < 0 || endByte < startByte) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    srcBytes.length,
                    startByte,
                    endByte);
            return "";
        }
        if (startByte == endByte) {
            return "";
        }
        if (startByte >= srcBytes.length) {
            log.warn("Start byte offset {} exceeds source byte length {}", startByte, srcBytes.length);
            return "";
        }
        if (endByte > srcBytes.length) {
            log.warn("End byte offset {} exceeds source byte length {}, truncating", endByte, srcBytes.length);
            endByte = srcBytes.length;
        }
        return new String(srcBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }
}
