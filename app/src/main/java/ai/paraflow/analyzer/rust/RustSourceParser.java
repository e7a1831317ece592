package ai.paraflow.analyzer.rust;

import static ai.paraflow.analyzer.rust.RustTreeSitterNodeTypes.ERROR;

import ai.paraflow.analyzer.ASTTraversalUtils;
import ai.paraflow.analyzer.ProjectFile;
import ai.paraflow.analyzer.SourceContent;
import java.io.IOException;
import java.nio.charset.MalformedInputException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterRust;

/**
 * Parses Rust sources with tree-sitter. Parsers are not thread-safe, so each worker thread gets its own.
 *
 * <p>Tree-sitter always produces a tree; a tree containing ERROR or MISSING nodes is reported as a failure unless the
 * parser is lenient.
 */
public final class RustSourceParser {
    private static final Logger log = LogManager.getLogger(RustSourceParser.class);

    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        parser.setLanguage(new TreeSitterRust());
        return parser;
    });

    private final boolean lenient;

    public RustSourceParser(boolean lenient) {
        this.lenient = lenient;
    }

    public ParseResult parse(ProjectFile file) {
        String text;
        try {
            text = file.read();
        } catch (MalformedInputException e) {
            log.warn("{} is not valid UTF-8", file);
            return new ParseResult.Failed(file, "not valid UTF-8", 1);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return new ParseResult.Failed(file, "unreadable: " + e.getMessage(), 1);
        }
        return parse(file, SourceContent.of(text));
    }

    public ParseResult parse(ProjectFile file, SourceContent content) {
        var tree = PARSER.get().parseString(null, content.text());
        var root = tree.getRootNode();
        if (root.hasError()) {
            var errors = ASTTraversalUtils.findAllNodesRecursive(
                    root, node -> ERROR.equals(node.getType()) || node.isMissing());
            int line = errors.isEmpty() ? 1 : ASTTraversalUtils.lineOf(errors.get(0));
            if (!lenient) {
                log.warn("{}:{}: syntax error, file excluded from the analysis", file, line);
                return new ParseResult.Failed(file, "syntax error", line);
            }
            log.debug("{}:{}: syntax error, analyzing the partial tree", file, line);
        }
        return new ParseResult.Parsed(file, content, tree);
    }
}
