package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.CallEdge;
import ai.paraflow.analyzer.CallSite;
import ai.paraflow.analyzer.FunctionId;
import ai.paraflow.analyzer.Provenance;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Arena entry for one function. Several {@code fn} items of the same name in one module (an inherent impl and a trait
 * impl, say) share a record: the first definition gives the line, call sites are merged.
 *
 * <p>Only {@link #markParallel} mutates analysis state, and it only ever grows it.
 */
public final class FunctionRecord {
    private final FunctionId id;
    private final int line;
    private boolean inherent;
    private boolean parallel;
    private final List<CallSite> callSites = new ArrayList<>();
    private List<CallEdge> edges = List.of();
    private final SortedSet<Provenance> provenance = new TreeSet<>();

    FunctionRecord(FunctionId id, int line) {
        this.id = id;
        this.line = line;
    }

    void absorb(FunctionSummary summary) {
        if (summary.inherent()) {
            inherent = true;
            parallel = true;
        }
        callSites.addAll(summary.callSites());
    }

    void setEdges(List<CallEdge> edges) {
        this.edges = List.copyOf(edges);
    }

    void markParallel(Collection<Provenance> causes) {
        parallel = true;
        provenance.addAll(causes);
    }

    public FunctionId id() {
        return id;
    }

    public int line() {
        return line;
    }

    public boolean isInherent() {
        return inherent;
    }

    public boolean isParallel() {
        return parallel;
    }

    public boolean isTransitive() {
        return parallel && !inherent;
    }

    public List<CallSite> callSites() {
        return List.copyOf(callSites);
    }

    public List<CallEdge> edges() {
        return edges;
    }

    public List<Provenance> provenance() {
        return List.copyOf(provenance);
    }

    @Override
    public String toString() {
        return "FunctionRecord{" + id + ", line=" + line + ", inherent=" + inherent + ", parallel=" + parallel + "}";
    }
}
