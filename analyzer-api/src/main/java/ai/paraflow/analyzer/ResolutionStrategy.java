package ai.paraflow.analyzer;

import java.util.List;
import java.util.Set;

/**
 * Maps imports and call sites to modules. This is the only place where names are matched to modules, so a resolver
 * backed by real type information can replace the name heuristics without touching propagation.
 *
 * <p>Implementations resolve against the functions modules <em>define</em>, never against which of them are currently
 * parallel; parallelism is looked up lazily while propagating.
 */
public interface ResolutionStrategy {

    /**
     * Modules whose names become visible in {@code importer} through its glob imports. Never contains the importer.
     */
    Set<ModuleKey> visibleModules(ModuleKey importer, List<ImportRecord> imports, ModuleCatalog catalog);

    /**
     * Target modules of one call site. Several targets mean the call is ambiguous; every one of them becomes an edge.
     * An empty result means the call is unresolved and is dropped.
     */
    Set<ModuleKey> resolveCall(FunctionId caller, CallSite site, Set<ModuleKey> visible, ModuleCatalog catalog);
}
