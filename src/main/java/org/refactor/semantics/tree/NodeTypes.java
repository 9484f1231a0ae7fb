package org.refactor.semantics.tree;

import java.util.Set;

/**
 * Node-type vocabulary shared by the analyzers, plus small child-lookup helpers.
 * <p>
 * Three tag families are recognized side by side: tree-sitter JavaScript/TypeScript names,
 * ESTree names, and tree-sitter Java names (which is what {@code JavaSyntaxTree} emits).
 */
public final class NodeTypes {

    private NodeTypes() {}

    public static final Set<String> IDENTIFIERS = Set.of("identifier", "Identifier");

    public static final Set<String> TYPE_ANNOTATIONS = Set.of("type_annotation", "type");

    public static final Set<String> BLOCKS = Set.of(
            "statement_block", "BlockStatement", "block", "constructor_body");

    /** Nodes that open a new function-level scope (closures included). */
    public static final Set<String> FUNCTIONS = Set.of(
            "function_declaration", "FunctionDeclaration",
            "generator_function_declaration",
            "function", "function_expression", "FunctionExpression",
            "arrow_function", "ArrowFunctionExpression",
            "method_definition", "MethodDefinition",
            "method_declaration", "constructor_declaration",
            "lambda_expression");

    public static final Set<String> VARIABLE_DECLARATIONS = Set.of(
            "variable_declaration", "VariableDeclaration", "lexical_declaration",
            "local_variable_declaration", "field_declaration");

    public static final Set<String> VARIABLE_DECLARATORS = Set.of(
            "variable_declarator", "VariableDeclarator");

    public static final Set<String> PARAMETER_LISTS = Set.of(
            "formal_parameters", "parameters", "inferred_parameters");

    public static final Set<String> ASSIGNMENTS = Set.of(
            "assignment_expression", "AssignmentExpression");

    public static final Set<String> UPDATES = Set.of(
            "update_expression", "UpdateExpression");

    public static final Set<String> MEMBER_ACCESSES = Set.of(
            "member_expression", "MemberExpression", "field_access");

    public static final Set<String> CALLS = Set.of(
            "call_expression", "CallExpression", "method_invocation");

    public static final Set<String> NULL_LITERALS = Set.of(
            "null", "null_literal", "undefined", "NullLiteral");

    public static final Set<String> OPTIONAL_CHAINS = Set.of(
            "optional_chain_expression", "OptionalMemberExpression", "optional_chain");

    public static final Set<String> CONDITIONALS = Set.of(
            "ternary_expression", "ConditionalExpression");

    public static final Set<String> CATCH_CLAUSES = Set.of("catch_clause", "CatchClause");

    public static final Set<String> FINALLY_CLAUSES = Set.of("finally_clause", "FinallyClause");

    public static final Set<String> SWITCH_BODIES = Set.of("switch_body", "switch_block");

    public static final Set<String> SWITCH_CASES = Set.of(
            "switch_case", "SwitchCase", "switch_default", "default",
            "switch_block_statement_group", "switch_rule");

    public static boolean isIdentifier(SyntaxNode node) {
        return node != null && IDENTIFIERS.contains(node.getType());
    }

    public static boolean isFunction(SyntaxNode node) {
        return node != null && FUNCTIONS.contains(node.getType());
    }

    public static boolean isBlock(SyntaxNode node) {
        return node != null && BLOCKS.contains(node.getType());
    }

    /**
     * Statement-like nodes, judged by tag the same way for every grammar: anything named
     * {@code *statement*} or {@code *declaration*}, except case groups which only live inside
     * switch bodies.
     */
    public static boolean isStatement(SyntaxNode node) {
        String type = node.getType();
        if (SWITCH_CASES.contains(type)) {
            return false;
        }
        return type.contains("statement") || type.contains("Statement")
                || type.contains("declaration") || type.contains("Declaration");
    }

    public static SyntaxNode firstChildOfType(SyntaxNode node, String type) {
        for (SyntaxNode child : node.getChildren()) {
            if (child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    public static SyntaxNode firstChildOfType(SyntaxNode node, Set<String> types) {
        for (SyntaxNode child : node.getChildren()) {
            if (types.contains(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /** Field lookup first, then the first child of one of {@code fallbackTypes}. */
    public static SyntaxNode fieldOrChild(SyntaxNode node, String field, Set<String> fallbackTypes) {
        SyntaxNode byField = node.getChildForFieldName(field);
        return byField != null ? byField : firstChildOfType(node, fallbackTypes);
    }

    /** The {@code name} field, or the first identifier-like child. */
    public static SyntaxNode nameOf(SyntaxNode node, String... identifierTypes) {
        SyntaxNode name = node.getChildForFieldName("name");
        if (name != null) {
            return name;
        }
        for (String type : identifierTypes) {
            SyntaxNode found = firstChildOfType(node, type);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Initializer of a variable declarator: the {@code value}/{@code init} field, or else the
     * child right after an {@code =} token. Type annotations are never initializers.
     */
    public static SyntaxNode initializerOf(SyntaxNode declarator) {
        SyntaxNode value = declarator.getChildForFieldName("value");
        if (value == null) {
            value = declarator.getChildForFieldName("init");
        }
        if (value != null) {
            return value;
        }
        boolean afterEquals = false;
        for (SyntaxNode child : declarator.getChildren()) {
            if (afterEquals) {
                return TYPE_ANNOTATIONS.contains(child.getType()) ? null : child;
            }
            afterEquals = child.getType().equals("=");
        }
        return null;
    }
}
