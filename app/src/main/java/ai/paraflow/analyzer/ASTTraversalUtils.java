package ai.paraflow.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Common tree-sitter traversal helpers shared by the Rust front end and the analysis passes. */
public final class ASTTraversalUtils {

    private ASTTraversalUtils() {}

    /** Recursively finds the first node matching the given predicate, in document order. */
    public static @Nullable TSNode findNodeRecursive(@Nullable TSNode rootNode, Predicate<TSNode> predicate) {
        if (isAbsent(rootNode)) {
            return null;
        }

        if (predicate.test(rootNode)) {
            return rootNode;
        }

        for (int i = 0; i < rootNode.getChildCount(); i++) {
            var result = findNodeRecursive(rootNode.getChild(i), predicate);
            if (result != null) {
                return result;
            }
        }

        return null;
    }

    /** Recursively finds all nodes matching the given predicate, in document order, including {@code rootNode}. */
    public static List<TSNode> findAllNodesRecursive(TSNode rootNode, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        findAllNodesRecursiveInternal(rootNode, predicate, results);
        return results;
    }

    private static void findAllNodesRecursiveInternal(
            @Nullable TSNode node, Predicate<TSNode> predicate, List<TSNode> results) {
        if (isAbsent(node)) {
            return;
        }

        if (predicate.test(node)) {
            results.add(node);
        }

        for (int i = 0; i < node.getChildCount(); i++) {
            findAllNodesRecursiveInternal(node.getChild(i), predicate, results);
        }
    }

    /** Finds all nodes of a specific type within the AST. */
    public static List<TSNode> findAllNodesByType(TSNode rootNode, String nodeType) {
        return findAllNodesRecursive(rootNode, node -> nodeType.equals(node.getType()));
    }

    /** Named children of a node, skipping punctuation and keywords. */
    public static List<TSNode> namedChildren(TSNode node) {
        var children = new ArrayList<TSNode>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (!isAbsent(child)) {
                children.add(child);
            }
        }
        return children;
    }

    /** The child stored under {@code fieldName}, or null when the field is absent. */
    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isAbsent(child) ? null : child;
    }

    /** Extracts trimmed text from a node using the provided SourceContent. */
    public static String extractNodeText(@Nullable TSNode node, SourceContent sourceContent) {
        if (isAbsent(node)) {
            return "";
        }
        return sourceContent.substringFrom(node).trim();
    }

    /** 1-based line on which the node starts. */
    public static int lineOf(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    public static boolean isAbsent(@Nullable TSNode node) {
        return node == null || node.isNull();
    }
}
