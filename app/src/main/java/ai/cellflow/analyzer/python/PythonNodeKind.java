package ai.cellflow.analyzer.python;

import static ai.cellflow.analyzer.python.PythonTreeSitterNodeTypes.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * The closed set of tree-sitter-python node kinds the symbol classifier distinguishes. Every node type string the
 * classifier knows maps onto exactly one constant; anything else is {@link #UNKNOWN}. The grammar's Python 2
 * {@code print}/{@code exec} statements are not mapped.
 */
public enum PythonNodeKind {
    IDENTIFIER(PythonTreeSitterNodeTypes.IDENTIFIER, KEYWORD_IDENTIFIER),
    DOTTED_NAME(PythonTreeSitterNodeTypes.DOTTED_NAME),
    ATTRIBUTE(PythonTreeSitterNodeTypes.ATTRIBUTE),
    SUBSCRIPT(PythonTreeSitterNodeTypes.SUBSCRIPT),
    CALL(PythonTreeSitterNodeTypes.CALL),
    KEYWORD_ARGUMENT(PythonTreeSitterNodeTypes.KEYWORD_ARGUMENT),
    NAMED_EXPRESSION(PythonTreeSitterNodeTypes.NAMED_EXPRESSION),
    LAMBDA(PythonTreeSitterNodeTypes.LAMBDA),
    ASSIGNMENT(PythonTreeSitterNodeTypes.ASSIGNMENT),
    AUGMENTED_ASSIGNMENT(PythonTreeSitterNodeTypes.AUGMENTED_ASSIGNMENT),
    DELETE_STATEMENT(PythonTreeSitterNodeTypes.DELETE_STATEMENT),
    TYPE_ALIAS_STATEMENT(PythonTreeSitterNodeTypes.TYPE_ALIAS_STATEMENT),
    FUNCTION_DEFINITION(PythonTreeSitterNodeTypes.FUNCTION_DEFINITION),
    CLASS_DEFINITION(PythonTreeSitterNodeTypes.CLASS_DEFINITION),
    DECORATED_DEFINITION(PythonTreeSitterNodeTypes.DECORATED_DEFINITION),
    FOR_STATEMENT(PythonTreeSitterNodeTypes.FOR_STATEMENT),
    WITH_ITEM(PythonTreeSitterNodeTypes.WITH_ITEM),
    EXCEPT_CLAUSE(PythonTreeSitterNodeTypes.EXCEPT_CLAUSE, EXCEPT_GROUP_CLAUSE),
    IMPORT_STATEMENT(PythonTreeSitterNodeTypes.IMPORT_STATEMENT),
    IMPORT_FROM_STATEMENT(PythonTreeSitterNodeTypes.IMPORT_FROM_STATEMENT),
    FUTURE_IMPORT_STATEMENT(PythonTreeSitterNodeTypes.FUTURE_IMPORT_STATEMENT),
    GLOBAL_STATEMENT(PythonTreeSitterNodeTypes.GLOBAL_STATEMENT),
    NONLOCAL_STATEMENT(PythonTreeSitterNodeTypes.NONLOCAL_STATEMENT),
    COMPREHENSION(LIST_COMPREHENSION, SET_COMPREHENSION, DICTIONARY_COMPREHENSION, GENERATOR_EXPRESSION),
    CASE_CLAUSE(PythonTreeSitterNodeTypes.CASE_CLAUSE),
    COMMENT(PythonTreeSitterNodeTypes.COMMENT),
    /** Statements and expressions without scope or binding effects; their children are visited in order. */
    PASSTHROUGH(
            "module",
            BLOCK,
            "expression_statement",
            "if_statement",
            "elif_clause",
            "else_clause",
            "while_statement",
            "finally_clause",
            TRY_STATEMENT,
            MATCH_STATEMENT,
            WITH_STATEMENT,
            WITH_CLAUSE,
            "return_statement",
            "pass_statement",
            "break_statement",
            "continue_statement",
            "raise_statement",
            "assert_statement",
            "binary_operator",
            "boolean_operator",
            "comparison_operator",
            "not_operator",
            "unary_operator",
            "conditional_expression",
            PARENTHESIZED_EXPRESSION,
            TUPLE,
            LIST,
            "set",
            "dictionary",
            "pair",
            EXPRESSION_LIST,
            "argument_list",
            "string",
            "concatenated_string",
            "interpolation",
            "format_specifier",
            "format_expression",
            "type_conversion",
            "string_start",
            "string_content",
            "string_end",
            "escape_sequence",
            "escape_interpolation",
            "integer",
            "float",
            "true",
            "false",
            "none",
            "ellipsis",
            "await",
            "yield",
            "slice",
            "type",
            "generic_type",
            "type_parameter",
            "union_type",
            "constrained_type",
            "member_type",
            "splat_type",
            LIST_SPLAT,
            "dictionary_splat",
            "parenthesized_list_splat",
            DECORATOR,
            IF_CLAUSE,
            "line_continuation"),
    UNKNOWN();

    private static final Map<String, PythonNodeKind> BY_TYPE = new HashMap<>();

    static {
        for (var kind : values()) {
            for (var type : kind.nodeTypes) {
                var previous = BY_TYPE.put(type, kind);
                if (previous != null) {
                    throw new IllegalStateException(
                            "Node type " + type + " mapped to both " + previous + " and " + kind);
                }
            }
        }
    }

    private final List<String> nodeTypes;

    PythonNodeKind(String... nodeTypes) {
        this.nodeTypes = List.of(nodeTypes);
    }

    public List<String> nodeTypes() {
        return nodeTypes;
    }

    public static PythonNodeKind of(String nodeType) {
        return BY_TYPE.getOrDefault(nodeType, UNKNOWN);
    }

    public static PythonNodeKind of(@Nullable TSNode node) {
        if (node == null || node.isNull()) {
            return UNKNOWN;
        }
        return of(node.getType());
    }
}
