package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.FunctionId;
import ai.paraflow.analyzer.ModuleKey;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Module key to the names of its functions that are currently known to be parallel. Seeded with the inherently
 * parallel functions and grown by propagation; names are never removed.
 *
 * <p>Not thread-safe. Propagation passes read a {@link #snapshot()} and merge into the live registry afterwards.
 */
public final class ParallelRegistry {
    private final Map<ModuleKey, Set<String>> parallelByModule;

    public ParallelRegistry() {
        this(new HashMap<>());
    }

    private ParallelRegistry(Map<ModuleKey, Set<String>> parallelByModule) {
        this.parallelByModule = parallelByModule;
    }

    public static ParallelRegistry seededFrom(FunctionArena arena) {
        var registry = new ParallelRegistry();
        for (var function : arena.functionRecords()) {
            if (function.isInherent()) {
                registry.add(function.id());
            }
        }
        return registry;
    }

    public boolean isParallel(ModuleKey module, String function) {
        return parallelByModule.getOrDefault(module, Set.of()).contains(function);
    }

    public boolean isParallel(FunctionId function) {
        return isParallel(function.module(), function.name());
    }

    public Set<String> parallelIn(ModuleKey module) {
        return Collections.unmodifiableSet(parallelByModule.getOrDefault(module, Set.of()));
    }

    /** Returns true when {@code function} was not registered before. */
    public boolean add(FunctionId function) {
        return parallelByModule
                .computeIfAbsent(function.module(), k -> new TreeSet<>())
                .add(function.name());
    }

    public int size() {
        return parallelByModule.values().stream().mapToInt(Set::size).sum();
    }

    /** An independent copy; later additions to either registry are not visible in the other. */
    public ParallelRegistry snapshot() {
        var copy = new HashMap<ModuleKey, Set<String>>();
        parallelByModule.forEach((module, names) -> copy.put(module, Set.copyOf(names)));
        return new ParallelRegistry(copy);
    }
}
