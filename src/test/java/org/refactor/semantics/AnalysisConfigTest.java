package org.refactor.semantics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.refactor.semantics.AnalysisConfig.ConfigException;
import org.refactor.semantics.flow.FlowAnalysisOptions;
import org.refactor.semantics.scope.Builtins;
import org.refactor.semantics.scope.SemanticAnalysisOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisConfigTest {

    @Test
    void defaultsEnableEverything() {
        AnalysisConfig config = AnalysisConfig.defaults();

        assertThat(config.getFlow().isDetectUnreachable()).isTrue();
        assertThat(config.getFlow().getMaxDepth()).isNull();
        assertThat(config.getSemantic().isIncludeBuiltins()).isTrue();
        assertThat(config.getSemantic().getBuiltins()).isSameAs(Builtins.DEFAULT);
        assertThat(config.getMethods()).isEmpty();
        assertThat(config.includesMethod("anything")).isTrue();
    }

    @Test
    void sectionsOverrideOnlyWhatTheyName() {
        AnalysisConfig config = AnalysisConfig.parse("{"
                + "\"flow\": {\"detectUnusedVariables\": false, \"maxDepth\": 3},"
                + "\"semantic\": {\"maxScopeDepth\": 2, \"builtins\": [\"app\"]},"
                + "\"methods\": [\"process\"]"
                + "}");

        FlowAnalysisOptions flow = config.getFlow();
        SemanticAnalysisOptions semantic = config.getSemantic();

        assertThat(flow.isDetectUnusedVariables()).isFalse();
        assertThat(flow.isDetectNullDereferences()).isTrue();
        assertThat(flow.getMaxDepth()).isEqualTo(3);
        assertThat(semantic.getMaxScopeDepth()).isEqualTo(2);
        assertThat(semantic.getBuiltins()).containsExactly("app");
        assertThat(semantic.isDetectShadowing()).isTrue();
        assertThat(config.includesMethod("process")).isTrue();
        assertThat(config.includesMethod("handle")).isFalse();
    }

    @Test
    void emptyDocumentMeansDefaults() {
        assertThat(AnalysisConfig.parse("").getMethods()).isEmpty();
        assertThat(AnalysisConfig.parse("{}").getFlow().isDetectInfiniteLoops()).isTrue();
    }

    @Test
    void malformedDocumentIsRejected() {
        assertThatThrownBy(() -> AnalysisConfig.parse("{\"flow\": ["))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("Malformed config");
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("analysis.json");
        Files.writeString(file, "{\"methods\": [\"run\"]}", StandardCharsets.UTF_8);

        assertThat(AnalysisConfig.load(file).getMethods()).containsExactly("run");
        assertThatThrownBy(() -> AnalysisConfig.load(dir.resolve("missing.json")))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("Config file not found: ");
    }
}
