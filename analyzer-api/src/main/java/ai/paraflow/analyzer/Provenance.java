package ai.paraflow.analyzer;

import java.util.Comparator;

/** Why a function became transitively parallel: the call at {@code callLine} to {@code module::function}. */
public record Provenance(int callLine, ModuleKey module, String function) implements Comparable<Provenance> {

    private static final Comparator<Provenance> ORDER = Comparator.comparingInt(Provenance::callLine)
            .thenComparing(Provenance::module)
            .thenComparing(Provenance::function);

    public static Provenance of(CallEdge edge) {
        return new Provenance(edge.line(), edge.target(), edge.calleeName());
    }

    @Override
    public int compareTo(Provenance other) {
        return ORDER.compare(this, other);
    }
}
