package ai.paraflow.analyzer.parallel;

import static ai.paraflow.analyzer.rust.RustTreeSitterNodeTypes.*;

import ai.paraflow.analyzer.ASTTraversalUtils;
import ai.paraflow.analyzer.CallKind;
import ai.paraflow.analyzer.CallSite;
import ai.paraflow.analyzer.SourceContent;
import ai.paraflow.analyzer.rust.RustPaths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Collects the calls of a function body and classifies their shape. Nothing is resolved here; resolution needs every
 * module of the run and happens after all files have been summarized.
 */
public final class CallSiteCollector {

    public List<CallSite> collect(TSNode functionItem, SourceContent source) {
        var body = ASTTraversalUtils.field(functionItem, "body");
        if (body == null) {
            return List.of();
        }
        var sites = new ArrayList<CallSite>();
        for (var call : ASTTraversalUtils.findAllNodesByType(body, CALL_EXPRESSION)) {
            classify(call, source).ifPresent(sites::add);
        }
        return sites;
    }

    Optional<CallSite> classify(TSNode call, SourceContent source) {
        var function = unwrapTurbofish(ASTTraversalUtils.field(call, FIELD_FUNCTION));
        if (function == null) {
            return Optional.empty();
        }
        switch (function.getType()) {
            case IDENTIFIER -> {
                return Optional.of(CallSite.unqualified(
                        ASTTraversalUtils.extractNodeText(function, source), ASTTraversalUtils.lineOf(call)));
            }
            case FIELD_EXPRESSION -> {
                var field = ASTTraversalUtils.field(function, FIELD_FIELD);
                // tuple fields (x.0) are never callable by name
                if (field == null || !FIELD_IDENTIFIER.equals(field.getType())) {
                    return Optional.empty();
                }
                return Optional.of(CallSite.receiver(
                        ASTTraversalUtils.extractNodeText(field, source), ASTTraversalUtils.lineOf(field)));
            }
            case SCOPED_IDENTIFIER -> {
                var name = ASTTraversalUtils.extractNodeText(ASTTraversalUtils.field(function, FIELD_NAME), source);
                var path = ASTTraversalUtils.field(function, FIELD_PATH);
                if (name.isEmpty()) {
                    return Optional.empty();
                }
                if (path == null) {
                    return Optional.of(CallSite.unqualified(name, ASTTraversalUtils.lineOf(call)));
                }
                var qualifier = RustPaths.segments(path, source);
                if (qualifier.isEmpty()) {
                    return Optional.empty();
                }
                var kind = BRACKETED_TYPE.equals(path.getType()) && RustPaths.isDisambiguated(path)
                        ? CallKind.DISAMBIGUATED_UFCS
                        : CallKind.QUALIFIED_PATH;
                return Optional.of(new CallSite(kind, name, qualifier, ASTTraversalUtils.lineOf(call)));
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    /** {@code f::<T>} and {@code x.m::<T>} are called like {@code f} and {@code x.m}. */
    static @Nullable TSNode unwrapTurbofish(@Nullable TSNode function) {
        if (function != null && GENERIC_FUNCTION.equals(function.getType())) {
            return ASTTraversalUtils.field(function, FIELD_FUNCTION);
        }
        return function;
    }
}
