package ai.paraflow.analyzer.rust;

public final class RustTreeSitterNodeTypes {

    // Declarations
    public static final String FUNCTION_ITEM = "function_item";
    public static final String USE_DECLARATION = "use_declaration";

    // Use trees
    public static final String USE_WILDCARD = "use_wildcard";
    public static final String USE_LIST = "use_list";
    public static final String SCOPED_USE_LIST = "scoped_use_list";
    public static final String USE_AS_CLAUSE = "use_as_clause";

    // Calls
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String MACRO_INVOCATION = "macro_invocation";
    public static final String FIELD_EXPRESSION = "field_expression";
    public static final String GENERIC_FUNCTION = "generic_function";

    // Paths and types
    public static final String IDENTIFIER = "identifier";
    public static final String FIELD_IDENTIFIER = "field_identifier";
    public static final String TYPE_IDENTIFIER = "type_identifier";
    public static final String SCOPED_IDENTIFIER = "scoped_identifier";
    public static final String SCOPED_TYPE_IDENTIFIER = "scoped_type_identifier";
    public static final String GENERIC_TYPE = "generic_type";
    public static final String BRACKETED_TYPE = "bracketed_type";
    public static final String QUALIFIED_TYPE = "qualified_type";
    public static final String REFERENCE_TYPE = "reference_type";

    // Errors
    public static final String ERROR = "ERROR";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_PATH = "path";
    public static final String FIELD_LIST = "list";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_FIELD = "field";
    public static final String FIELD_MACRO = "macro";
    public static final String FIELD_ARGUMENT = "argument";

    private RustTreeSitterNodeTypes() {}
}
