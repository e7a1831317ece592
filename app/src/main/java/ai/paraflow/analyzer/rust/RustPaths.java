package ai.paraflow.analyzer.rust;

import static ai.paraflow.analyzer.rust.RustTreeSitterNodeTypes.*;

import ai.paraflow.analyzer.ASTTraversalUtils;
import ai.paraflow.analyzer.SourceContent;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Flattens Rust path-like nodes ({@code a::b::C}, {@code C::<T>}, {@code <C as Trait>}) into their name segments.
 * Generic arguments are dropped and for a qualified type only the concrete type is kept.
 */
public final class RustPaths {

    private RustPaths() {}

    public static List<String> segments(@Nullable TSNode node, SourceContent source) {
        var out = new ArrayList<String>();
        collect(node, source, out);
        return out;
    }

    private static void collect(@Nullable TSNode node, SourceContent source, List<String> out) {
        if (ASTTraversalUtils.isAbsent(node)) {
            return;
        }
        switch (node.getType()) {
            case SCOPED_IDENTIFIER, SCOPED_TYPE_IDENTIFIER -> {
                collect(ASTTraversalUtils.field(node, FIELD_PATH), source, out);
                collect(ASTTraversalUtils.field(node, FIELD_NAME), source, out);
            }
            case GENERIC_TYPE, QUALIFIED_TYPE, REFERENCE_TYPE -> collect(
                    ASTTraversalUtils.field(node, FIELD_TYPE), source, out);
            case BRACKETED_TYPE -> {
                var children = ASTTraversalUtils.namedChildren(node);
                if (!children.isEmpty()) {
                    collect(children.get(0), source, out);
                }
            }
            default -> {
                if (node.getNamedChildCount() == 0) {
                    var text = ASTTraversalUtils.extractNodeText(node, source);
                    if (!text.isEmpty()) {
                        out.add(text);
                    }
                }
            }
        }
    }

    /** Whether a {@code bracketed_type} path is the {@code <Type as Trait>} form. */
    public static boolean isDisambiguated(TSNode bracketedType) {
        return ASTTraversalUtils.namedChildren(bracketedType).stream()
                .anyMatch(child -> QUALIFIED_TYPE.equals(child.getType()));
    }
}
