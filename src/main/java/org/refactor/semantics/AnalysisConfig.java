package org.refactor.semantics;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.refactor.semantics.flow.FlowAnalysisOptions;
import org.refactor.semantics.scope.SemanticAnalysisOptions;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * JSON configuration of the command-line tool:
 * <pre>
 * {
 *   "flow":     { "detectUnusedVariables": false, "maxDepth": 20 },
 *   "semantic": { "includeBuiltins": true, "maxScopeDepth": 8 },
 *   "methods":  [ "process", "handle" ]
 * }
 * </pre>
 * Every section is optional. Option field names are those of {@link FlowAnalysisOptions}
 * and {@link SemanticAnalysisOptions}.
 */
public class AnalysisConfig {

    private static final Gson GSON = new Gson();

    private FlowAnalysisOptions flow;
    private SemanticAnalysisOptions semantic;
    private List<String> methods;

    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    public static AnalysisConfig load(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigException("Config file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return orDefaults(GSON.fromJson(reader, AnalysisConfig.class));
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        } catch (JsonParseException e) {
            throw new ConfigException("Malformed config " + path + ": " + e.getMessage(), e);
        }
    }

    public static AnalysisConfig parse(String json) {
        try {
            return orDefaults(GSON.fromJson(json, AnalysisConfig.class));
        } catch (JsonParseException e) {
            throw new ConfigException("Malformed config: " + e.getMessage(), e);
        }
    }

    private static AnalysisConfig orDefaults(AnalysisConfig config) {
        return config != null ? config : defaults();
    }

    public FlowAnalysisOptions getFlow() {
        return flow != null ? flow : FlowAnalysisOptions.defaults();
    }

    public SemanticAnalysisOptions getSemantic() {
        return semantic != null ? semantic : SemanticAnalysisOptions.defaults();
    }

    /** Method names to report on; empty means all. */
    public List<String> getMethods() {
        return methods != null ? methods : List.of();
    }

    public boolean includesMethod(String name) {
        return getMethods().isEmpty() || getMethods().contains(name);
    }

    public static class ConfigException extends RuntimeException {
        public ConfigException(String message) { super(message); }
        public ConfigException(String message, Throwable cause) { super(message, cause); }
    }
}
