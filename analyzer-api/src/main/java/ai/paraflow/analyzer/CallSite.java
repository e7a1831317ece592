package ai.paraflow.analyzer;

import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A raw, unresolved call found in a function body.
 *
 * @param kind the syntactic shape of the call
 * @param calleeName the called function or method name (last path segment)
 * @param qualifier the path segments in front of the callee name; for a UFCS call these are the segments of the
 *     concrete type, the trait is dropped. Empty for unqualified and receiver calls.
 * @param line 1-based line of the call expression
 */
public record CallSite(CallKind kind, String calleeName, List<String> qualifier, int line) {

    public CallSite {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(calleeName, "calleeName");
        qualifier = List.copyOf(qualifier);
    }

    public static CallSite unqualified(String calleeName, int line) {
        return new CallSite(CallKind.UNQUALIFIED, calleeName, List.of(), line);
    }

    public static CallSite receiver(String calleeName, int line) {
        return new CallSite(CallKind.RECEIVER_METHOD, calleeName, List.of(), line);
    }

    /** The type or module hint of a qualified call: the segment right before the callee name. */
    public @Nullable String typeHint() {
        return qualifier.isEmpty() ? null : qualifier.get(qualifier.size() - 1);
    }
}
