package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.CallEdge;
import ai.paraflow.analyzer.ResolutionStrategy;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns the raw call sites of every function into edges. Edges carry a target module and a callee name only; whether
 * the callee is parallel is decided while propagating.
 */
public final class CallGraphExtractor {
    private static final Logger log = LogManager.getLogger(CallGraphExtractor.class);

    private final ResolutionStrategy strategy;

    public CallGraphExtractor(ResolutionStrategy strategy) {
        this.strategy = strategy;
    }

    /**
     * Resolves visibility and edges of one module. Reads the arena, writes only the given module's records, so
     * different modules may be extracted concurrently.
     *
     * @return the number of edges created
     */
    public int extractModule(ModuleRecord module, FunctionArena arena) {
        var visible = strategy.visibleModules(module.key(), module.imports(), arena);
        module.setVisible(visible);

        int total = 0;
        int unresolved = 0;
        for (var function : module.functions()) {
            var edges = new LinkedHashSet<CallEdge>();
            for (var site : function.callSites()) {
                var targets = strategy.resolveCall(function.id(), site, visible, arena);
                if (targets.isEmpty()) {
                    unresolved++;
                    continue;
                }
                for (var target : targets) {
                    edges.add(new CallEdge(function.id(), site.calleeName(), site.kind(), target, site.line()));
                }
            }
            function.setEdges(new ArrayList<>(edges));
            total += edges.size();
        }
        log.debug(
                "{}: {} visible modules, {} edges, {} unresolved calls",
                module.key(),
                visible.size(),
                total,
                unresolved);
        return total;
    }
}
