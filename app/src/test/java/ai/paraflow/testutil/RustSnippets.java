package ai.paraflow.testutil;

import static ai.paraflow.analyzer.rust.RustTreeSitterNodeTypes.FIELD_NAME;
import static ai.paraflow.analyzer.rust.RustTreeSitterNodeTypes.FUNCTION_ITEM;

import ai.paraflow.analyzer.ASTTraversalUtils;
import ai.paraflow.analyzer.ProjectFile;
import ai.paraflow.analyzer.SourceContent;
import ai.paraflow.analyzer.rust.ParseResult;
import ai.paraflow.analyzer.rust.RustSourceParser;
import java.nio.file.Path;
import org.treesitter.TSNode;

/** Parses inline Rust code for tests that work on single syntax trees. */
public final class RustSnippets {

    private RustSnippets() {}

    public static ParseResult.Parsed parse(String source) {
        var result = new RustSourceParser(false)
                .parse(new ProjectFile(Path.of("snippets"), "Snippet.rs"), SourceContent.of(source));
        if (result instanceof ParseResult.Parsed parsed) {
            return parsed;
        }
        throw new AssertionError("Snippet does not parse: " + result);
    }

    /** The first {@code fn} item with the given name. */
    public static TSNode function(ParseResult.Parsed parsed, String name) {
        var node = ASTTraversalUtils.findNodeRecursive(
                parsed.root(),
                n -> FUNCTION_ITEM.equals(n.getType())
                        && name.equals(ASTTraversalUtils.extractNodeText(
                                ASTTraversalUtils.field(n, FIELD_NAME), parsed.content())));
        if (node == null) {
            throw new AssertionError("No function named " + name);
        }
        return node;
    }
}
