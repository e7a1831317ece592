package ai.paraflow.analyzer.parallel;

import static ai.paraflow.analyzer.rust.RustTreeSitterNodeTypes.*;

import ai.paraflow.analyzer.ASTTraversalUtils;
import ai.paraflow.analyzer.SourceContent;
import ai.paraflow.analyzer.rust.RustPaths;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Flags functions whose body calls a parallel primitive.
 *
 * <p>The whole body is scanned, so a primitive inside a closure (or a nested item) counts for the enclosing function.
 * This over-approximates: a closure that is built but never run still makes its function parallel.
 */
public final class PrimitiveDetector {
    private static final Logger log = LogManager.getLogger(PrimitiveDetector.class);

    private final PrimitiveVocabulary vocabulary;

    public PrimitiveDetector(PrimitiveVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public boolean isInherentlyParallel(TSNode functionItem, SourceContent source) {
        return findPrimitive(functionItem, source).isPresent();
    }

    /** Name of the first primitive called in the function body. */
    public Optional<String> findPrimitive(TSNode functionItem, SourceContent source) {
        var body = ASTTraversalUtils.field(functionItem, "body");
        if (body == null) {
            return Optional.empty();
        }
        var hit = ASTTraversalUtils.findNodeRecursive(body, node -> primitiveName(node, source) != null);
        if (hit == null) {
            return Optional.empty();
        }
        var name = primitiveName(hit, source);
        log.trace("Primitive {} at line {}", name, ASTTraversalUtils.lineOf(hit));
        return Optional.ofNullable(name);
    }

    private @Nullable String primitiveName(TSNode node, SourceContent source) {
        switch (node.getType()) {
            case CALL_EXPRESSION -> {
                var function = CallSiteCollector.unwrapTurbofish(ASTTraversalUtils.field(node, FIELD_FUNCTION));
                if (function == null) {
                    return null;
                }
                if (FIELD_EXPRESSION.equals(function.getType())) {
                    var method =
                            ASTTraversalUtils.extractNodeText(ASTTraversalUtils.field(function, FIELD_FIELD), source);
                    return vocabulary.methods().contains(method) ? method : null;
                }
                if (IDENTIFIER.equals(function.getType()) || SCOPED_IDENTIFIER.equals(function.getType())) {
                    var segments = RustPaths.segments(function, source);
                    if (segments.isEmpty()) {
                        return null;
                    }
                    // last segment only, so aliased paths like rayon::join still match
                    var name = segments.get(segments.size() - 1);
                    return vocabulary.functions().contains(name) ? name : null;
                }
                return null;
            }
            case MACRO_INVOCATION -> {
                var segments = RustPaths.segments(ASTTraversalUtils.field(node, FIELD_MACRO), source);
                return segments.stream()
                        .filter(vocabulary.macros()::contains)
                        .findFirst()
                        .orElse(null);
            }
            default -> {
                return null;
            }
        }
    }
}
