package org.refactor.semantics.flow;

import java.util.HashMap;
import java.util.Map;

/**
 * CFG 构建时区分的控制流结构。解析器的节点类型通过 {@link #of(String)} 归类，
 * 未知类型归为 {@link #OTHER}。
 */
public enum Construct {
    BLOCK("program", "Program", "statement_block", "BlockStatement", "block", "constructor_body"),
    IF("if_statement", "IfStatement"),
    FOR("for_statement", "ForStatement"),
    FOR_EACH("for_in_statement", "ForInStatement", "for_of_statement", "ForOfStatement",
            "enhanced_for_statement"),
    WHILE("while_statement", "WhileStatement"),
    DO_WHILE("do_statement", "DoWhileStatement"),
    SWITCH("switch_statement", "SwitchStatement"),
    TRY("try_statement", "TryStatement", "try_with_resources_statement"),
    RETURN("return_statement", "ReturnStatement"),
    THROW("throw_statement", "ThrowStatement"),
    BREAK("break_statement", "BreakStatement"),
    CONTINUE("continue_statement", "ContinueStatement"),
    LABELED("labeled_statement", "LabeledStatement"),
    DECLARATION("variable_declaration", "VariableDeclaration", "lexical_declaration",
            "local_variable_declaration"),
    STATEMENT("expression_statement", "ExpressionStatement"),
    OTHER;

    private static final Map<String, Construct> BY_TAG = new HashMap<>();

    static {
        for (Construct construct : values()) {
            for (String tag : construct.tags) {
                BY_TAG.put(tag, construct);
            }
        }
    }

    private final String[] tags;

    Construct(String... tags) {
        this.tags = tags;
    }

    public static Construct of(String nodeType) {
        return BY_TAG.getOrDefault(nodeType, OTHER);
    }

    public boolean isLoop() {
        return this == FOR || this == FOR_EACH || this == WHILE || this == DO_WHILE;
    }
}
