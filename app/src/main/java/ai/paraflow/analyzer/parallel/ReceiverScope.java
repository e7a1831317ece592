package ai.paraflow.analyzer.parallel;

/** Which modules a receiver method call {@code expr.method(...)} may resolve to. */
public enum ReceiverScope {
    /** Every module that defines a function of that name. */
    ALL_MODULES,
    /** Only the caller's own module and the modules its glob imports make visible. */
    VISIBLE_MODULES
}
