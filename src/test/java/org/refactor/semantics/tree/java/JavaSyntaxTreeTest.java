package org.refactor.semantics.tree.java;

import org.junit.jupiter.api.Test;
import org.refactor.semantics.query.AstQuery;
import org.refactor.semantics.tree.Position;
import org.refactor.semantics.tree.SyntaxNode;

import static org.assertj.core.api.Assertions.assertThat;

class JavaSyntaxTreeTest {

    private static final String SIGN = String.join("\n",
            "class A {",
            "    int sign(int x) {",
            "        if (x > 0) {",
            "            return 1;",
            "        }",
            "        return 0;",
            "    }",
            "}");

    private static final String RUN = String.join("\n",
            "class B {",
            "    void run(int i, int total) {",
            "        try {",
            "            work(i++);",
            "        } catch (IllegalStateException e) {",
            "            total += 2;",
            "        } finally {",
            "            done();",
            "        }",
            "    }",
            "}");

    private final JavaSourceParser parser = new JavaSourceParser();
    private final AstQuery query = new AstQuery();

    @Test
    void classAndMethodShape() {
        SyntaxNode root = parser.parseTree(SIGN);
        SyntaxNode type = root.getChildren().get(0);
        SyntaxNode method = query.findFirstNodeByType(root, "method_declaration");

        assertThat(root.getType()).isEqualTo("program");
        assertThat(root.getStartPosition()).isEqualTo(Position.ORIGIN);
        assertThat(type.getType()).isEqualTo("class_declaration");
        assertThat(type.getChildForFieldName("name").getText()).isEqualTo("A");
        assertThat(type.getChildForFieldName("body").getType()).isEqualTo("class_body");

        assertThat(method.getStartPosition()).isEqualTo(new Position(1, 4));
        assertThat(method.getChildForFieldName("type").getType()).isEqualTo("integral_type");
        assertThat(method.getChildForFieldName("name").getText()).isEqualTo("sign");
        assertThat(method.getChildForFieldName("parameters").getText()).isEqualTo("(int x)");
        assertThat(method.getChildForFieldName("body").getType()).isEqualTo("block");

        SyntaxNode parameter = method.getChildForFieldName("parameters").getChildren().get(0);
        assertThat(parameter.getType()).isEqualTo("formal_parameter");
        assertThat(parameter.getChildForFieldName("name").getText()).isEqualTo("x");
    }

    @Test
    void conditionsKeepTheirParentheses() {
        SyntaxNode ifStatement = query.findFirstNodeByType(parser.parseTree(SIGN), "if_statement");
        SyntaxNode condition = ifStatement.getChildForFieldName("condition");
        SyntaxNode comparison = condition.getChildren().get(0);

        assertThat(ifStatement.getStartPosition()).isEqualTo(new Position(2, 8));
        assertThat(condition.getType()).isEqualTo("parenthesized_expression");
        assertThat(condition.getText()).isEqualTo("(x > 0)");
        assertThat(comparison.getType()).isEqualTo("binary_expression");
        assertThat(comparison.getChildForFieldName("operator").getType()).isEqualTo(">");
        assertThat(ifStatement.getChildForFieldName("consequence").getType()).isEqualTo("block");
        assertThat(ifStatement.getChildForFieldName("alternative")).isNull();
    }

    @Test
    void tryCatchFinallyShape() {
        SyntaxNode tryStatement = query.findFirstNodeByType(parser.parseTree(RUN), "try_statement");
        SyntaxNode catchClause = query.findFirstNodeByType(tryStatement, "catch_clause");
        SyntaxNode finallyClause = query.findFirstNodeByType(tryStatement, "finally_clause");
        SyntaxNode catchParameter = catchClause.getChildren().get(0);

        assertThat(tryStatement.getChildForFieldName("body").getType()).isEqualTo("block");
        assertThat(catchParameter.getType()).isEqualTo("catch_formal_parameter");
        assertThat(catchParameter.getChildren().get(0).getType()).isEqualTo("catch_type");
        assertThat(catchParameter.getChildForFieldName("name").getText()).isEqualTo("e");
        assertThat(finallyClause.getText()).startsWith("finally");
        assertThat(finallyClause.getChildForFieldName("body").getType()).isEqualTo("block");
    }

    @Test
    void updatesAndCompoundAssignments() {
        SyntaxNode root = parser.parseTree(RUN);
        SyntaxNode update = query.findFirstNodeByType(root, "update_expression");
        SyntaxNode assignment = query.findFirstNodeByType(root, "assignment_expression");
        SyntaxNode call = query.findFirstNodeByType(root, "method_invocation");

        assertThat(update.getText()).isEqualTo("i++");
        assertThat(update.getChildren()).singleElement()
                .satisfies(operand -> assertThat(operand.getType()).isEqualTo("identifier"));
        assertThat(assignment.getChildForFieldName("left").getText()).isEqualTo("total");
        assertThat(assignment.getChildForFieldName("operator").getType()).isEqualTo("+=");
        assertThat(call.getChildForFieldName("object")).isNull();
        assertThat(call.getChildForFieldName("name").getText()).isEqualTo("work");
        assertThat(call.getChildForFieldName("arguments").getType()).isEqualTo("argument_list");
    }

    @Test
    void importsAndPackage() {
        SyntaxNode root = parser.parseTree(String.join("\n",
                "package demo.app;",
                "import java.util.List;",
                "class C {}"));

        assertThat(root.getChildren()).extracting(SyntaxNode::getType)
                .containsExactly("package_declaration", "import_declaration", "class_declaration");
        assertThat(root.getChildren().get(1).getText()).isEqualTo("import java.util.List;");
        assertThat(root.getChildren().get(1).getChildren().get(0).getType()).isEqualTo("scoped_identifier");
    }

    @Test
    void tagsForUnmappedNodes() {
        assertThat(JavaSyntaxTree.tagFor("MethodCallExpr")).isEqualTo("method_call_expression");
        assertThat(JavaSyntaxTree.tagFor("LocalClassDeclarationStmt")).isEqualTo("local_class_declaration_statement");
        assertThat(JavaSyntaxTree.tagFor("SimpleName")).isEqualTo("simple_name");
    }
}
