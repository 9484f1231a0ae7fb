package org.refactor.semantics;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    private static final String SAMPLE = String.join("\n",
            "class Sample {",
            "    int sign(int x) {",
            "        if (x > 0) {",
            "            return 1;",
            "        }",
            "    }",
            "",
            "    void spin() {",
            "        while (true) {",
            "            tick();",
            "        }",
            "    }",
            "}");

    private static final String TREE = "{\"type\": \"program\", \"children\": ["
            + "{\"type\": \"return_statement\", \"text\": \"return\"},"
            + "{\"type\": \"expression_statement\", \"text\": \"dead\","
            + " \"startPosition\": {\"row\": 1, \"column\": 0}, \"endPosition\": {\"row\": 1, \"column\": 4}}"
            + "]}";

    @TempDir
    Path dir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @Test
    void flowModeReportsEveryMethod() throws IOException {
        int status = Main.run(new String[]{write("Sample.java", SAMPLE).toString()}, out);

        JsonObject json = output();
        assertThat(status).isZero();
        assertThat(json.keySet()).containsExactly("sign@2", "spin@8");
        assertThat(json.getAsJsonObject("sign@2").getAsJsonArray("missingReturns")).hasSize(1);
        assertThat(json.getAsJsonObject("spin@8").getAsJsonArray("infiniteLoops")).hasSize(1);
    }

    @Test
    void configRestrictsMethods() throws IOException {
        Path config = write("config.json", "{\"methods\": [\"spin\"], \"flow\": {\"detectInfiniteLoops\": false}}");

        int status = Main.run(new String[]{write("Sample.java", SAMPLE).toString(), "--config", config.toString()}, out);

        JsonObject json = output();
        assertThat(status).isZero();
        assertThat(json.keySet()).containsExactly("spin@8");
        assertThat(json.getAsJsonObject("spin@8").getAsJsonArray("infiniteLoops")).isEmpty();
    }

    @Test
    void semanticAndStatsModes() throws IOException {
        Path source = write("Sample.java", SAMPLE);

        assertThat(Main.run(new String[]{source.toString(), "--mode", "semantic"}, out)).isZero();
        JsonObject semantic = output();
        assertThat(semantic.has("symbols")).isTrue();
        assertThat(semantic.getAsJsonObject("symbols").has("scope_0:Sample")).isTrue();

        buffer.reset();
        assertThat(Main.run(new String[]{"--mode", "STATS", source.toString()}, out)).isZero();
        assertThat(output().get("nodeCount").getAsInt()).isGreaterThan(10);
    }

    @Test
    void syntaxTreeJsonIsAnalyzedAsAProgram() throws IOException {
        int status = Main.run(new String[]{write("tree.json", TREE).toString()}, out);

        JsonObject json = output();
        assertThat(status).isZero();
        assertThat(json.getAsJsonArray("unreachableCode")).hasSize(1);
        assertThat(json.getAsJsonObject("controlFlow").getAsJsonArray("nodes")).hasSize(4);
    }

    @Test
    void usageErrors() {
        assertThat(Main.run(new String[]{}, out)).isEqualTo(Main.EXIT_USAGE);
        assertThat(Main.run(new String[]{"a.java", "--verbose"}, out)).isEqualTo(Main.EXIT_USAGE);
        assertThat(Main.run(new String[]{"a.java", "--mode", "graph"}, out)).isEqualTo(Main.EXIT_USAGE);
        assertThat(Main.run(new String[]{"a.java", "--config"}, out)).isEqualTo(Main.EXIT_USAGE);
        assertThat(Main.run(new String[]{"a.java", "b.java"}, out)).isEqualTo(Main.EXIT_USAGE);
        assertThat(buffer.size()).isZero();
    }

    @Test
    void failuresExitWithOne() throws IOException {
        Path broken = write("Broken.java", "class Broken { void f( }");
        Path malformed = write("bad.json", "{\"flow\": [");
        Path source = write("Sample.java", SAMPLE);

        assertThat(Main.run(new String[]{dir.resolve("Absent.java").toString()}, out)).isEqualTo(Main.EXIT_FAILURE);
        assertThat(Main.run(new String[]{dir.resolve("absent.json").toString()}, out)).isEqualTo(Main.EXIT_FAILURE);
        assertThat(Main.run(new String[]{broken.toString()}, out)).isEqualTo(Main.EXIT_FAILURE);
        assertThat(Main.run(new String[]{source.toString(), "--config", malformed.toString()}, out))
                .isEqualTo(Main.EXIT_FAILURE);
        assertThat(Main.run(new String[]{source.toString(), "--config", dir.resolve("none.json").toString()}, out))
                .isEqualTo(Main.EXIT_FAILURE);
        assertThat(buffer.size()).isZero();
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private JsonObject output() {
        return JsonParser.parseString(buffer.toString(StandardCharsets.UTF_8)).getAsJsonObject();
    }
}
