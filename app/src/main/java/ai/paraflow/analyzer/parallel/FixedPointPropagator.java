package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.CallEdge;
import ai.paraflow.analyzer.Provenance;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Computes the least fixed point of "is parallel" over the call graph.
 *
 * <p>Each round first closes every module over its own edges, then makes one pass over the cross-module edges of all
 * functions; rounds repeat until a cross-module pass flags nothing. Every pass evaluates against a frozen copy of the
 * flags and merges its findings only when it is complete, so the result does not depend on evaluation order and the
 * evaluation itself may be split across the workers of an executor.
 */
public final class FixedPointPropagator {
    private static final Logger log = LogManager.getLogger(FixedPointPropagator.class);

    private final PropagationListener listener;
    private final @Nullable ExecutorService executor;
    private final int workers;

    /** Evaluates every pass on the calling thread. */
    public FixedPointPropagator(PropagationListener listener) {
        this(listener, null, 1);
    }

    /** Splits each pass into at most {@code workers} slices evaluated on {@code executor}. */
    public FixedPointPropagator(PropagationListener listener, @Nullable ExecutorService executor, int workers) {
        this.listener = listener;
        this.executor = executor;
        this.workers = workers;
    }

    private record Flagging(FunctionRecord function, List<Provenance> causes) {}

    public PropagationStats propagate(FunctionArena arena, ParallelRegistry registry) {
        int seeded = registry.size();
        int rounds = 0;
        int intraPasses = 0;
        int interPasses = 0;
        int added;
        do {
            rounds++;
            for (var module : arena.moduleRecords()) {
                intraPasses += closeModule(module, registry);
            }
            interPasses++;
            added = interModulePass(arena, registry, interPasses);
        } while (added > 0);

        var stats = new PropagationStats(rounds, intraPasses, interPasses, seeded, registry.size());
        log.info(
                "Propagation converged after {} rounds: {} inherent, {} transitive",
                rounds,
                seeded,
                stats.transitive());
        return stats;
    }

    /** Intra-module passes until one adds nothing. Returns the number of passes run. */
    private int closeModule(ModuleRecord module, ParallelRegistry registry) {
        int pass = 0;
        int added;
        do {
            pass++;
            var frozen = Set.copyOf(registry.parallelIn(module.key()));
            var found = evaluate(
                    module.functions(), CallEdge::isIntraModule, edge -> frozen.contains(edge.calleeName()));
            added = merge(found, registry);
            listener.passCompleted(
                    new PassEvent(PassEvent.Phase.INTRA_MODULE, module.key(), pass, added, registry.size()));
        } while (added > 0);
        if (pass > 1) {
            log.debug("{}: intra-module closure took {} passes", module.key(), pass);
        }
        return pass;
    }

    private int interModulePass(FunctionArena arena, ParallelRegistry registry, int pass) {
        var frozen = registry.snapshot();
        var found = evaluate(
                arena.functionRecords(),
                edge -> !edge.isIntraModule(),
                edge -> frozen.isParallel(edge.callee()));
        int added = merge(found, registry);
        listener.passCompleted(new PassEvent(PassEvent.Phase.INTER_MODULE, null, pass, added, registry.size()));
        log.debug("Inter-module pass {} flagged {} functions", pass, added);
        return added;
    }

    /** Reads only; the frozen registry and the records' flags do not change while a pass evaluates. */
    private List<Flagging> evaluate(
            Collection<FunctionRecord> functions, Predicate<CallEdge> edgeFilter, Predicate<CallEdge> targetParallel) {
        var candidates = List.copyOf(functions);
        if (executor == null || workers < 2 || candidates.size() < 2) {
            return evaluateSlice(candidates, edgeFilter, targetParallel);
        }
        int sliceSize = (candidates.size() + workers - 1) / workers;
        var slices = new ArrayList<Callable<List<Flagging>>>();
        for (int from = 0; from < candidates.size(); from += sliceSize) {
            var slice = candidates.subList(from, Math.min(from + sliceSize, candidates.size()));
            slices.add(() -> evaluateSlice(slice, edgeFilter, targetParallel));
        }
        var found = new ArrayList<Flagging>();
        ParallelismAnalyzer.invokeAll(executor, slices).forEach(found::addAll);
        return found;
    }

    private static List<Flagging> evaluateSlice(
            List<FunctionRecord> functions, Predicate<CallEdge> edgeFilter, Predicate<CallEdge> targetParallel) {
        return functions.stream()
                .filter(f -> !f.isParallel())
                .map(f -> new Flagging(
                        f,
                        f.edges().stream()
                                .filter(edgeFilter)
                                .filter(targetParallel)
                                .map(Provenance::of)
                                .collect(Collectors.toList())))
                .filter(flagging -> !flagging.causes().isEmpty())
                .collect(Collectors.toList());
    }

    private static int merge(List<Flagging> found, ParallelRegistry registry) {
        int added = 0;
        for (var flagging : found) {
            flagging.function().markParallel(flagging.causes());
            if (registry.add(flagging.function().id())) {
                added++;
            }
        }
        return added;
    }
}
