package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.ModuleKey;
import ai.paraflow.analyzer.ProjectFile;
import java.util.Comparator;
import java.util.List;

/** Classified functions of one module, ordered by line, then name. */
public record ModuleResult(ModuleKey key, ProjectFile file, List<FunctionResult> functions) {

    static final Comparator<FunctionResult> FUNCTION_ORDER =
            Comparator.comparingInt(FunctionResult::line).thenComparing(FunctionResult::name);

    public ModuleResult {
        functions = functions.stream().sorted(FUNCTION_ORDER).toList();
    }

    public List<FunctionResult> withStatus(ParallelStatus status) {
        return functions.stream().filter(f -> f.status() == status).toList();
    }

    public boolean hasInherent() {
        return functions.stream().anyMatch(f -> f.status() == ParallelStatus.INHERENT);
    }

    public boolean hasTransitive() {
        return functions.stream().anyMatch(f -> f.status() == ParallelStatus.TRANSITIVE);
    }

    public boolean isParallel() {
        return hasInherent() || hasTransitive();
    }
}
