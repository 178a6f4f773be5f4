package io.github.flowdiff.analyzer.python;

/** Constants for Python TreeSitter node type and field names. */
public final class PythonTreeSitterNodeTypes {

    // Definitions
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";
    public static final String DECORATOR = "decorator";
    public static final String LAMBDA = "lambda";

    // Parameters
    public static final String IDENTIFIER = "identifier";
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    public static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    public static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";

    // Statements
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String IF_STATEMENT = "if_statement";
    public static final String ELIF_CLAUSE = "elif_clause";
    public static final String ELSE_CLAUSE = "else_clause";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String EXCEPT_CLAUSE = "except_clause";
    public static final String FINALLY_CLAUSE = "finally_clause";
    public static final String WITH_STATEMENT = "with_statement";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String ASSIGNMENT = "assignment";
    public static final String BLOCK = "block";

    // Expressions
    public static final String CALL = "call";
    public static final String ATTRIBUTE = "attribute";
    public static final String STRING = "string";
    public static final String LIST = "list";
    public static final String KEYWORD_ARGUMENT = "keyword_argument";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String RELATIVE_IMPORT = "relative_import";
    public static final String WILDCARD_IMPORT = "wildcard_import";

    // Keywords
    public static final String ASYNC = "async";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_PARAMETERS = "parameters";
    public static final String FIELD_RETURN_TYPE = "return_type";
    public static final String FIELD_SUPERCLASSES = "superclasses";
    public static final String FIELD_DEFINITION = "definition";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_ARGUMENTS = "arguments";
    public static final String FIELD_OBJECT = "object";
    public static final String FIELD_ATTRIBUTE = "attribute";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_ALIAS = "alias";
    public static final String FIELD_MODULE_NAME = "module_name";
    public static final String FIELD_CONDITION = "condition";
    public static final String FIELD_CONSEQUENCE = "consequence";
    public static final String FIELD_ALTERNATIVE = "alternative";

    private PythonTreeSitterNodeTypes() {}
}
