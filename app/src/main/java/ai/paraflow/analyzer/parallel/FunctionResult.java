package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.FunctionId;
import ai.paraflow.analyzer.Provenance;
import java.util.List;

/** Final classification of one function. {@code provenance} is empty unless the function is transitive. */
public record FunctionResult(FunctionId id, int line, ParallelStatus status, List<Provenance> provenance) {

    public FunctionResult {
        provenance = List.copyOf(provenance);
    }

    static FunctionResult of(FunctionRecord record) {
        var status = record.isInherent()
                ? ParallelStatus.INHERENT
                : record.isParallel() ? ParallelStatus.TRANSITIVE : ParallelStatus.NOT_PARALLEL;
        var provenance = status == ParallelStatus.TRANSITIVE ? record.provenance() : List.<Provenance>of();
        return new FunctionResult(record.id(), record.line(), status, provenance);
    }

    public String name() {
        return id.name();
    }
}
