package org.refactor.semantics.tree.java;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class JavaSourceParserTest {

    private final JavaSourceParser parser = new JavaSourceParser();

    @Test
    void validSourceHasNoProblems() {
        assertThat(parser.validate("class A { void f() { int x = 1; } }")).isEmpty();
        assertThat(parser.isValid("record Point(int x, int y) {}")).isTrue();
    }

    @Test
    void brokenSourceReportsProblems() {
        List<SourceProblem> problems = parser.validate("class A { void f( }");

        assertThat(problems).isNotEmpty();
        assertThat(problems.get(0).toString()).startsWith("Line ");
        assertThat(parser.isValid("class A { void f( }")).isFalse();
    }

    @Test
    void emptySourceIsAProblem() {
        assertThat(parser.validate("")).containsExactly(new SourceProblem(-1, "Source is empty"));
        assertThat(parser.validate("  \n ")).hasSize(1);
        assertThat(parser.validate(null)).hasSize(1);
    }

    @Test
    void parseThrowsWithEveryProblem() {
        SourceParseException error = catchThrowableOfType(
                () -> parser.parse("class A { int x = ; }"), SourceParseException.class);

        assertThat(error).hasMessageContaining("syntax problem");
        assertThat(error.getProblems()).isNotEmpty();
        assertThatThrownBy(() -> parser.parseTree(""))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("Source is empty");
    }

    @Test
    void parseReturnsCompilationUnit() {
        assertThat(parser.parse("class A {}").getType(0).getNameAsString()).isEqualTo("A");
        assertThat(parser.parseTree("class A {}").getType()).isEqualTo("program");
    }
}
