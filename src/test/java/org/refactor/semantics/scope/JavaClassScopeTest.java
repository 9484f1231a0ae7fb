package org.refactor.semantics.scope;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.refactor.semantics.tree.java.JavaSourceParser;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Scope resolution over trees produced by the JavaParser front end.
 */
class JavaClassScopeTest {

    private static final String GREETER = String.join("\n",
            "package demo;",
            "",
            "import java.util.List;",
            "import static java.util.Objects.requireNonNull;",
            "import java.io.*;",
            "",
            "public class Greeter {",
            "    private final String greeting;",
            "    protected int count, total;",
            "",
            "    public Greeter(String greeting) {",
            "        this.greeting = requireNonNull(greeting);",
            "    }",
            "",
            "    public String greet(List<String> names) {",
            "        for (String name : names) {",
            "            count++;",
            "        }",
            "        return greeting;",
            "    }",
            "",
            "    private void reset() {",
            "        count = 0;",
            "    }",
            "}");

    private SemanticAnalysisResult result;
    private Map<String, SymbolInfo> symbols;

    @BeforeEach
    void analyze() {
        result = new SemanticAnalyzer().analyze(new JavaSourceParser().parseTree(GREETER));
        symbols = result.symbols();
    }

    @Test
    void singleTypeAndStaticImportsAreBound() {
        assertThat(symbols.get("scope_0:List").kind).isEqualTo(SymbolKind.CLASS);
        assertThat(symbols.get("scope_0:List").imported).isTrue();
        assertThat(symbols.get("scope_0:requireNonNull").kind).isEqualTo(SymbolKind.VARIABLE);
        assertThat(symbols.get("scope_0:requireNonNull").references).hasSize(1);
        assertThat(symbols.keySet()).noneMatch(key -> key.endsWith(":io") || key.endsWith(":*"));
    }

    @Test
    void classMembers() {
        SymbolInfo type = symbols.get("scope_0:Greeter");
        assertThat(type.kind).isEqualTo(SymbolKind.CLASS);
        assertThat(type.visibility).isEqualTo(Visibility.PUBLIC);

        assertThat(symbols.get("scope_1:greeting").kind).isEqualTo(SymbolKind.PROPERTY);
        assertThat(symbols.get("scope_1:greeting").visibility).isEqualTo(Visibility.PRIVATE);
        assertThat(symbols.get("scope_1:count").visibility).isEqualTo(Visibility.PROTECTED);
        assertThat(symbols.get("scope_1:total").visibility).isEqualTo(Visibility.PROTECTED);

        SymbolInfo greet = symbols.get("scope_1:greet");
        assertThat(greet.kind).isEqualTo(SymbolKind.METHOD);
        assertThat(greet.visibility).isEqualTo(Visibility.PUBLIC);
        assertThat(greet.parameters).extracting(ParameterInfo::name).containsExactly("names");
        assertThat(symbols.get("scope_1:reset").visibility).isEqualTo(Visibility.PRIVATE);
    }

    @Test
    void scopesFollowTheClassLayout() {
        assertThat(result.scopes()).extracting(ScopeInfo::kind).containsExactly(
                ScopeKind.GLOBAL, ScopeKind.CLASS, ScopeKind.FUNCTION, ScopeKind.FUNCTION, ScopeKind.LOOP,
                ScopeKind.FUNCTION);
        assertThat(result.scopes().get(2).symbols()).containsExactly("this", "greeting");
        assertThat(symbols.get("scope_4:name").kind).isEqualTo(SymbolKind.VARIABLE);
    }

    @Test
    void fieldUsesResolveThroughTheClassScope() {
        assertThat(symbols.get("scope_1:count").references).extracting(SymbolReference::kind)
                .containsExactly(ReferenceKind.WRITE, ReferenceKind.WRITE);
        assertThat(symbols.get("scope_1:greeting").references).extracting(SymbolReference::kind)
                .containsExactly(ReferenceKind.READ);
        assertThat(symbols.get("scope_2:greeting").references).hasSize(1);
        assertThat(symbols.get("scope_3:names").references).hasSize(1);
        assertThat(result.unresolvedReferences()).isEmpty();
    }

    @Test
    void constructorParameterShadowsField() {
        assertThat(result.shadowedVariables()).extracting(ShadowedVariable::name).contains("greeting");
    }
}
