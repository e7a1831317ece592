package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.FunctionId;
import ai.paraflow.analyzer.ModuleCatalog;
import ai.paraflow.analyzer.ModuleKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Every module and function of one run, indexed by {@link ModuleKey} and {@link FunctionId}. Built once from the file
 * summaries after all workers finished; afterwards only the parallel flags of its records change.
 */
public final class FunctionArena implements ModuleCatalog {
    private static final Logger log = LogManager.getLogger(FunctionArena.class);

    private final Map<ModuleKey, ModuleRecord> modules = new TreeMap<>();
    private final Map<FunctionId, FunctionRecord> functions = new TreeMap<>();
    private final Map<String, Set<ModuleKey>> modulesByName = new HashMap<>();
    private final Map<String, Set<ModuleKey>> definersByFunction = new HashMap<>();

    private FunctionArena() {}

    /**
     * Builds the arena. Files that would share a module key are told apart by qualifying each of them with its parent
     * directory, or with its whole directory path when the parent names collide as well.
     */
    public static FunctionArena build(Collection<FileSummary> summaries) {
        var arena = new FunctionArena();
        var byKey = summaries.stream()
                .sorted(Comparator.comparing(FileSummary::file))
                .collect(Collectors.groupingBy(FileSummary::module, TreeMap::new, Collectors.toList()));
        for (var group : byKey.values()) {
            var keyed = group.size() == 1 ? group : disambiguate(group);
            keyed.forEach(arena::add);
        }
        log.debug("Arena holds {} modules and {} functions", arena.modules.size(), arena.functions.size());
        return arena;
    }

    private static List<FileSummary> disambiguate(List<FileSummary> group) {
        var byParent = group.stream().map(s -> qualified(s, parentName(s))).toList();
        boolean distinct = byParent.stream().map(FileSummary::module).distinct().count() == group.size();
        var keyed = distinct ? byParent : group.stream().map(s -> qualified(s, parentPath(s))).toList();
        for (var summary : keyed) {
            log.debug(
                    "{}: module name {} is shared, keyed as {}",
                    summary.file(),
                    summary.module().name(),
                    summary.module());
        }
        return keyed;
    }

    private static FileSummary qualified(FileSummary summary, String qualifier) {
        return summary.withModule(new ModuleKey(qualifier, summary.module().name()));
    }

    private static String parentName(FileSummary summary) {
        var directory = summary.file().getDirectoryName();
        return directory == null ? "" : directory;
    }

    /** {@code src/alpha/x/mod.rs} becomes {@code src::alpha::x}. */
    private static String parentPath(FileSummary summary) {
        var parent = summary.file().getRelPath().getParent();
        if (parent == null) {
            return "";
        }
        var segments = new ArrayList<String>();
        parent.forEach(segment -> segments.add(segment.toString()));
        return String.join("::", segments);
    }

    private void add(FileSummary summary) {
        var key = summary.module();
        var module = new ModuleRecord(key, summary.file(), summary.imports());
        modules.put(key, module);
        modulesByName.computeIfAbsent(key.name(), k -> new TreeSet<>()).add(key);
        for (var fn : summary.functions()) {
            var id = new FunctionId(key, fn.name());
            var record = functions.get(id);
            if (record == null) {
                record = new FunctionRecord(id, fn.line());
                functions.put(id, record);
                module.addFunction(record);
                definersByFunction.computeIfAbsent(fn.name(), k -> new TreeSet<>()).add(key);
            }
            record.absorb(fn);
        }
    }

    public Collection<ModuleRecord> moduleRecords() {
        return Collections.unmodifiableCollection(modules.values());
    }

    public Optional<ModuleRecord> module(ModuleKey key) {
        return Optional.ofNullable(modules.get(key));
    }

    public Collection<FunctionRecord> functionRecords() {
        return Collections.unmodifiableCollection(functions.values());
    }

    public Optional<FunctionRecord> function(FunctionId id) {
        return Optional.ofNullable(functions.get(id));
    }

    public int functionCount() {
        return functions.size();
    }

    @Override
    public Set<ModuleKey> modules() {
        return Collections.unmodifiableSet(modules.keySet());
    }

    @Override
    public Set<ModuleKey> modulesNamed(String name) {
        return Collections.unmodifiableSet(modulesByName.getOrDefault(name, Set.of()));
    }

    @Override
    public boolean defines(ModuleKey module, String function) {
        return functions.containsKey(new FunctionId(module, function));
    }

    @Override
    public Set<ModuleKey> modulesDefining(String function) {
        return Collections.unmodifiableSet(definersByFunction.getOrDefault(function, Set.of()));
    }
}
