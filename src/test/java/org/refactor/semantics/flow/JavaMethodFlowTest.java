package org.refactor.semantics.flow;

import org.junit.jupiter.api.Test;
import org.refactor.semantics.query.AstQuery;
import org.refactor.semantics.tree.SyntaxNode;
import org.refactor.semantics.tree.java.JavaSourceParser;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Flow analysis over trees produced by the JavaParser front end.
 */
class JavaMethodFlowTest {

    private final JavaSourceParser parser = new JavaSourceParser();
    private final FlowAnalyzer analyzer = new FlowAnalyzer();

    @Test
    void fallingOffANonVoidMethod() {
        FlowAnalysisResult result = analyzeMethod("class A { int sign(int x) { if (x > 0) { return 1; } } }");

        assertThat(result.missingReturns).hasSize(1);
        assertThat(result.dataFlow.reads).extracting(DataFlowVariable::name).containsExactly("x");
    }

    @Test
    void everyPathReturns() {
        FlowAnalysisResult result = analyzeMethod(
                "class A { int sign(int x) { if (x > 0) { return 1; } else { return -1; } } }");

        assertThat(result.missingReturns).isEmpty();
        assertThat(result.controlFlow.nodesOfKind(CfgNodeKind.RETURN)).hasSize(2);
    }

    @Test
    void whileTrueInVoidMethod() {
        FlowAnalysisResult result = analyzeMethod("class A { void spin() { while (true) { tick(); } } }");

        assertThat(result.infiniteLoops).hasSize(1);
        assertThat(result.missingReturns).isEmpty();
    }

    @Test
    void codeAfterReturn() {
        FlowAnalysisResult result = analyzeMethod(
                "class A { int f() { return 1; System.out.println(); } }");

        assertThat(result.unreachableCode).hasSize(1);
    }

    @Test
    void unusedLocal() {
        FlowAnalysisResult result = analyzeMethod(String.join("\n",
                "class A {",
                "    void g() {",
                "        int unused = 1;",
                "        int used = 2;",
                "        System.out.println(used);",
                "    }",
                "}"));

        assertThat(result.dataFlow.unusedVariables).containsExactly("unused");
        assertThat(result.dataFlow.reads).extracting(DataFlowVariable::name).containsExactly("used");
    }

    @Test
    void lambdaCapturesLocal() {
        FlowAnalysisResult result = analyzeMethod(String.join("\n",
                "class A {",
                "    Runnable r() {",
                "        int limit = 3;",
                "        return () -> check(limit);",
                "    }",
                "}"));

        assertThat(result.dataFlow.captures).extracting(DataFlowVariable::name).containsExactly("limit");
        assertThat(result.dataFlow.reads).isEmpty();
        assertThat(result.dataFlow.unusedVariables).containsExactly("limit");
        assertThat(result.missingReturns).isEmpty();
    }

    @Test
    void enhancedForBindsItsVariable() {
        FlowAnalysisResult result = analyzeMethod(String.join("\n",
                "class A {",
                "    void each(java.util.List<String> items) {",
                "        for (String item : items) {",
                "            print(item);",
                "        }",
                "    }",
                "}"));

        assertThat(result.dataFlow.reads).extracting(DataFlowVariable::name).containsExactly("items", "item");
        assertThat(result.dataFlow.uninitializedReads).isEmpty();
        assertThat(result.controlFlow.nodesOfKind(CfgNodeKind.LOOP)).hasSize(1);
    }

    private FlowAnalysisResult analyzeMethod(String source) {
        SyntaxNode method = new AstQuery().findFirstNodeByType(parser.parseTree(source), "method_declaration");
        return analyzer.analyzeFunction(method);
    }
}
