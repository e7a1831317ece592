package ai.paraflow.analyzer;

import java.util.Comparator;
import java.util.Objects;

/** A function or method, identified by its module and its simple name. */
public record FunctionId(ModuleKey module, String name) implements Comparable<FunctionId> {

    private static final Comparator<FunctionId> ORDER =
            Comparator.comparing(FunctionId::module).thenComparing(FunctionId::name);

    public FunctionId {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public int compareTo(FunctionId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return module.key() + "::" + name;
    }
}
