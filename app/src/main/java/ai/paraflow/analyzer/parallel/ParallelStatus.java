package ai.paraflow.analyzer.parallel;

public enum ParallelStatus {
    /** Calls a parallel primitive directly. */
    INHERENT,
    /** Reaches an inherently parallel function through calls. */
    TRANSITIVE,
    NOT_PARALLEL
}
