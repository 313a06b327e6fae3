package ai.cellflow.analyzer.python;

/** Constants for the tree-sitter-python node type names the symbol classifier cares about. */
public final class PythonTreeSitterNodeTypes {

    // Names
    public static final String IDENTIFIER = "identifier";
    public static final String KEYWORD_IDENTIFIER = "keyword_identifier";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String ATTRIBUTE = "attribute";
    public static final String SUBSCRIPT = "subscript";

    // Expressions with binding or mutation effects
    public static final String CALL = "call";
    public static final String KEYWORD_ARGUMENT = "keyword_argument";
    public static final String NAMED_EXPRESSION = "named_expression";
    public static final String LAMBDA = "lambda";
    public static final String AS_PATTERN = "as_pattern";
    public static final String AS_PATTERN_TARGET = "as_pattern_target";

    // Assignment-like statements
    public static final String ASSIGNMENT = "assignment";
    public static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";
    public static final String DELETE_STATEMENT = "delete_statement";
    public static final String TYPE_ALIAS_STATEMENT = "type_alias_statement";

    // Targets
    public static final String PATTERN_LIST = "pattern_list";
    public static final String TUPLE_PATTERN = "tuple_pattern";
    public static final String LIST_PATTERN = "list_pattern";
    public static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    public static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";
    public static final String TUPLE = "tuple";
    public static final String LIST = "list";
    public static final String EXPRESSION_LIST = "expression_list";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String LIST_SPLAT = "list_splat";

    // Definitions
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";
    public static final String DECORATOR = "decorator";

    // Parameters
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";

    // Compound statements
    public static final String FOR_STATEMENT = "for_statement";
    public static final String WITH_STATEMENT = "with_statement";
    public static final String WITH_CLAUSE = "with_clause";
    public static final String WITH_ITEM = "with_item";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String EXCEPT_CLAUSE = "except_clause";
    public static final String EXCEPT_GROUP_CLAUSE = "except_group_clause";
    public static final String BLOCK = "block";
    public static final String MATCH_STATEMENT = "match_statement";
    public static final String CASE_CLAUSE = "case_clause";
    public static final String CASE_PATTERN = "case_pattern";
    public static final String CLASS_PATTERN = "class_pattern";
    public static final String KEYWORD_PATTERN = "keyword_pattern";
    public static final String SPLAT_PATTERN = "splat_pattern";
    public static final String IF_CLAUSE = "if_clause";

    // Imports and declarations
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String WILDCARD_IMPORT = "wildcard_import";
    public static final String GLOBAL_STATEMENT = "global_statement";
    public static final String NONLOCAL_STATEMENT = "nonlocal_statement";

    // Comprehensions
    public static final String LIST_COMPREHENSION = "list_comprehension";
    public static final String SET_COMPREHENSION = "set_comprehension";
    public static final String DICTIONARY_COMPREHENSION = "dictionary_comprehension";
    public static final String GENERATOR_EXPRESSION = "generator_expression";
    public static final String FOR_IN_CLAUSE = "for_in_clause";

    public static final String COMMENT = "comment";
    public static final String ERROR = "ERROR";

    private PythonTreeSitterNodeTypes() {
        // Utility class - no instantiation
    }
}
