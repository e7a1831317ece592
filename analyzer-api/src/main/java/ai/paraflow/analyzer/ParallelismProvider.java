package ai.paraflow.analyzer;

import java.util.List;
import java.util.Set;

/** Implemented by analysis results that can answer parallelism queries. */
public interface ParallelismProvider {

    boolean isParallel(FunctionId function);

    boolean isInherentlyParallel(FunctionId function);

    Set<FunctionId> parallelFunctions();

    /** Calls that made {@code function} transitively parallel; empty for inherent or non-parallel functions. */
    List<Provenance> provenanceOf(FunctionId function);
}
