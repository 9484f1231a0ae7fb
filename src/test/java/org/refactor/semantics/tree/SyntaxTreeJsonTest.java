package org.refactor.semantics.tree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.refactor.semantics.tree.SyntaxTreeJson.TreeReadException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyntaxTreeJsonTest {

    private static final String IF_STATEMENT = "{"
            + "\"type\": \"program\","
            + "\"startPosition\": {\"row\": 0, \"column\": 0},"
            + "\"endPosition\": {\"row\": 2, \"column\": 1},"
            + "\"children\": [{"
            + "  \"type\": \"if_statement\", \"text\": \"if (ok) { go(); }\","
            + "  \"startPosition\": {\"row\": 0, \"column\": 0},"
            + "  \"endPosition\": {\"row\": 2, \"column\": 1},"
            + "  \"children\": ["
            + "    {\"type\": \"parenthesized_expression\", \"field\": \"condition\", \"text\": \"(ok)\"},"
            + "    {\"type\": \"statement_block\", \"field\": \"consequence\", \"text\": \"{ go(); }\"}"
            + "  ]"
            + "}]}";

    @Test
    void parsesTypesFieldsAndPositions() {
        SyntaxNode root = SyntaxTreeJson.parse(IF_STATEMENT);
        SyntaxNode ifStatement = root.getChildren().get(0);

        assertThat(root.getType()).isEqualTo("program");
        assertThat(root.getText()).isEmpty();
        assertThat(root.getEndPosition()).isEqualTo(new Position(2, 1));
        assertThat(ifStatement.getChildCount()).isEqualTo(2);
        assertThat(ifStatement.getChildForFieldName("condition").getText()).isEqualTo("(ok)");
        assertThat(ifStatement.getChildForFieldName("consequence").getType()).isEqualTo("statement_block");
        assertThat(ifStatement.getChildForFieldName("alternative")).isNull();
    }

    @Test
    void missingPositionsDefaultToOrigin() {
        SyntaxNode leaf = SyntaxTreeJson.parse("{\"type\": \"identifier\", \"text\": \"x\"}");

        assertThat(leaf.getStartPosition()).isEqualTo(Position.ORIGIN);
        assertThat(leaf.getEndPosition()).isEqualTo(Position.ORIGIN);
        assertThat(leaf.getChildren()).isEmpty();
    }

    @Test
    void nodeWithoutTypeIsRejected() {
        assertThatThrownBy(() -> SyntaxTreeJson.parse("{\"type\": \"program\", \"children\": [{\"text\": \"x\"}]}"))
                .isInstanceOf(TreeReadException.class)
                .hasMessageContaining("without a type");
    }

    @Test
    void malformedJsonIsRejected() {
        assertThatThrownBy(() -> SyntaxTreeJson.parse("{\"type\": "))
                .isInstanceOf(TreeReadException.class)
                .hasMessageStartingWith("Malformed syntax tree JSON");
        assertThatThrownBy(() -> SyntaxTreeJson.parse(""))
                .isInstanceOf(TreeReadException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void readsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tree.json");
        Files.writeString(file, IF_STATEMENT, StandardCharsets.UTF_8);

        assertThat(SyntaxTreeJson.read(file).getChildren()).hasSize(1);
        assertThatThrownBy(() -> SyntaxTreeJson.read(dir.resolve("absent.json")))
                .isInstanceOf(TreeReadException.class)
                .hasMessageContaining("not found");
    }
}
