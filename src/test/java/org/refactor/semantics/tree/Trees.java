package org.refactor.semantics.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Hand-made syntax trees for tests, shaped like tree-sitter JavaScript output.
 * <p>
 * Trees are described as {@link Shape}s and turned into {@link SyntaxNode}s by {@link #build}.
 * Positions are synthetic but properly nested: nodes are numbered in pre-order, a node starts
 * at row {@code n}, column 0, and ends at column 1000 of the last row of its subtree. Siblings
 * therefore never overlap and parents always contain their children. Interior nodes without
 * explicit text get their children's texts joined by spaces.
 */
public final class Trees {

    private Trees() {}

    public static final class Shape {
        final String type;
        final String text;
        final List<Shape> children;
        String field;

        Shape(String type, String text, List<Shape> children) {
            this.type = type;
            this.text = text;
            this.children = children;
        }

        /** Binds this node to a grammar field of its parent. */
        public Shape as(String field) {
            this.field = field;
            return this;
        }
    }

    public static SyntaxNode build(Shape root) {
        return new Numbering().build(root);
    }

    /** Builds a {@code program} holding {@code statements}. */
    public static SyntaxNode program(Shape... statements) {
        return build(node("program", statements));
    }

    // ------------------------------------------------------------------
    // generic shapes
    // ------------------------------------------------------------------

    public static Shape node(String type, Shape... children) {
        return new Shape(type, null, new ArrayList<>(Arrays.asList(children)));
    }

    public static Shape leaf(String type, String text) {
        return new Shape(type, text, new ArrayList<>());
    }

    public static Shape id(String name) {
        return leaf("identifier", name);
    }

    public static Shape num(String value) {
        return leaf("number", value);
    }

    // ------------------------------------------------------------------
    // statements
    // ------------------------------------------------------------------

    public static Shape block(Shape... statements) {
        return node("statement_block", statements);
    }

    /** {@code let name;} */
    public static Shape let(String name) {
        return node("lexical_declaration", node("variable_declarator", id(name).as("name")));
    }

    /** {@code let name = value;} */
    public static Shape let(String name, Shape value) {
        return node("lexical_declaration",
                node("variable_declarator", id(name).as("name"), value.as("value")));
    }

    public static Shape expr(Shape expression) {
        return node("expression_statement", expression);
    }

    /** An expression statement reading {@code name}. */
    public static Shape use(String name) {
        return expr(id(name));
    }

    public static Shape ret(Shape... value) {
        return value.length == 0 ? leaf("return_statement", "return") : node("return_statement", value);
    }

    public static Shape brk() {
        return leaf("break_statement", "break");
    }

    public static Shape cont() {
        return leaf("continue_statement", "continue");
    }

    public static Shape ifThen(Shape condition, Shape consequence) {
        return node("if_statement", paren(condition).as("condition"), consequence.as("consequence"));
    }

    public static Shape ifElse(Shape condition, Shape consequence, Shape alternative) {
        return node("if_statement", paren(condition).as("condition"), consequence.as("consequence"),
                node("else_clause", alternative).as("alternative"));
    }

    public static Shape whileLoop(Shape condition, Shape body) {
        return node("while_statement", paren(condition).as("condition"), body.as("body"));
    }

    public static Shape paren(Shape inner) {
        return node("parenthesized_expression", inner);
    }

    // ------------------------------------------------------------------
    // expressions
    // ------------------------------------------------------------------

    public static Shape call(Shape callee, Shape... arguments) {
        return node("call_expression", callee.as("function"), node("arguments", arguments).as("arguments"));
    }

    public static Shape member(Shape object, String property) {
        return node("member_expression", object.as("object"), leaf("property_identifier", property).as("property"));
    }

    public static Shape assign(String target, Shape value) {
        return node("assignment_expression", id(target).as("left"), leaf("=", "=").as("operator"),
                value.as("right"));
    }

    public static Shape increment(String target) {
        return node("update_expression", id(target).as("argument"), leaf("++", "++").as("operator"));
    }

    /** {@code function name(params) body} */
    public static Shape function(String name, List<String> params, Shape body) {
        Shape parameters = node("formal_parameters",
                params.stream().map(Trees::id).toArray(Shape[]::new));
        return node("function_declaration", id(name).as("name"), parameters.as("parameters"), body.as("body"));
    }

    /** {@code (params) => body} */
    public static Shape arrow(List<String> params, Shape body) {
        Shape parameters = node("formal_parameters",
                params.stream().map(Trees::id).toArray(Shape[]::new));
        return node("arrow_function", parameters.as("parameters"), body.as("body"));
    }

    /** Assigns pre-order rows while building. */
    private static final class Numbering {
        private int row;

        SyntaxNode build(Shape shape) {
            int startRow = row++;
            List<SyntaxNode> built = new ArrayList<>();
            for (Shape child : shape.children) {
                built.add(build(child));
            }
            int endRow = row - 1;

            String text = shape.text != null
                    ? shape.text
                    : built.stream().map(SyntaxNode::getText).collect(Collectors.joining(" "));
            SimpleSyntaxNode.Builder builder = SimpleSyntaxNode.builder(shape.type)
                    .text(text)
                    .span(new Position(startRow, 0), new Position(endRow, 1000));
            for (int i = 0; i < built.size(); i++) {
                builder.child(shape.children.get(i).field, built.get(i));
            }
            return builder.build();
        }
    }
}
