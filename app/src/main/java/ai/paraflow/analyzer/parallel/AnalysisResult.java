package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.FunctionId;
import ai.paraflow.analyzer.ModuleKey;
import ai.paraflow.analyzer.ParallelismProvider;
import ai.paraflow.analyzer.Provenance;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/** Outcome of an analysis run: modules ordered by path, and the files that took no part in it. */
public final class AnalysisResult implements ParallelismProvider {
    private final List<ModuleResult> modules;
    private final List<FileFailure> failures;
    private final PropagationStats stats;
    private final Map<FunctionId, FunctionResult> index = new HashMap<>();

    public AnalysisResult(List<ModuleResult> modules, List<FileFailure> failures, PropagationStats stats) {
        this.modules = modules.stream()
                .sorted(Comparator.comparing(ModuleResult::file))
                .toList();
        this.failures = failures.stream()
                .sorted(Comparator.comparing(FileFailure::file))
                .toList();
        this.stats = stats;
        for (var module : this.modules) {
            for (var function : module.functions()) {
                index.put(function.id(), function);
            }
        }
    }

    public List<ModuleResult> modules() {
        return modules;
    }

    public List<FileFailure> failures() {
        return failures;
    }

    public PropagationStats stats() {
        return stats;
    }

    public Optional<ModuleResult> module(ModuleKey key) {
        return modules.stream().filter(m -> m.key().equals(key)).findFirst();
    }

    public Optional<FunctionResult> function(FunctionId id) {
        return Optional.ofNullable(index.get(id));
    }

    public Optional<FunctionResult> function(String moduleKey, String name) {
        return function(new FunctionId(ModuleKey.parse(moduleKey), name));
    }

    public ParallelStatus statusOf(FunctionId id) {
        var function = index.get(id);
        return function == null ? ParallelStatus.NOT_PARALLEL : function.status();
    }

    @Override
    public boolean isParallel(FunctionId function) {
        return statusOf(function) != ParallelStatus.NOT_PARALLEL;
    }

    @Override
    public boolean isInherentlyParallel(FunctionId function) {
        return statusOf(function) == ParallelStatus.INHERENT;
    }

    @Override
    public Set<FunctionId> parallelFunctions() {
        var parallel = new TreeSet<FunctionId>();
        index.values().stream()
                .filter(f -> f.status() != ParallelStatus.NOT_PARALLEL)
                .forEach(f -> parallel.add(f.id()));
        return Collections.unmodifiableSet(parallel);
    }

    @Override
    public List<Provenance> provenanceOf(FunctionId function) {
        var result = index.get(function);
        return result == null ? List.of() : result.provenance();
    }
}
