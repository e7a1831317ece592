package ai.paraflow.analyzer;

import java.util.Objects;

/**
 * A resolved call from {@code caller} to the function named {@code calleeName} in module {@code target}. Whether the
 * callee is parallel is not part of the edge; it is looked up when the edge is evaluated.
 */
public record CallEdge(FunctionId caller, String calleeName, CallKind kind, ModuleKey target, int line) {

    public CallEdge {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(calleeName, "calleeName");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
    }

    public boolean isIntraModule() {
        return caller.module().equals(target);
    }

    public FunctionId callee() {
        return new FunctionId(target, calleeName);
    }
}
