package ai.paraflow.analyzer;

/** Syntactic shape of a call expression, which decides how its target module is resolved. */
public enum CallKind {
    /** {@code f(...)} */
    UNQUALIFIED,
    /** {@code Type::method(...)} or {@code module::f(...)} */
    QUALIFIED_PATH,
    /** {@code <Type as Trait>::method(...)} */
    DISAMBIGUATED_UFCS,
    /** {@code expr.method(...)} */
    RECEIVER_METHOD
}
