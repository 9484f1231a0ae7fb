package org.refactor.semantics.tree;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a syntax tree dumped as JSON by an external parser.
 * <p>
 * Expected shape, per node:
 * <pre>
 * { "type": "if_statement", "text": "...", "field": "consequence",
 *   "startPosition": {"row": 0, "column": 0}, "endPosition": {"row": 2, "column": 1},
 *   "children": [ ... ] }
 * </pre>
 * {@code field} names the grammar field the node is bound to in its parent; everything but
 * {@code type} is optional.
 */
public final class SyntaxTreeJson {

    private static final Gson GSON = new Gson();

    private SyntaxTreeJson() {}

    public static SyntaxNode read(Path path) {
        if (!Files.exists(path)) {
            throw new TreeReadException("Syntax tree file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return toNode(GSON.fromJson(reader, JsonNode.class), path.toString());
        } catch (IOException e) {
            throw new TreeReadException("Failed to read syntax tree: " + path, e);
        } catch (JsonParseException e) {
            throw new TreeReadException("Malformed syntax tree JSON in " + path + ": " + e.getMessage(), e);
        }
    }

    public static SyntaxNode parse(String json) {
        try {
            return toNode(GSON.fromJson(json, JsonNode.class), "<string>");
        } catch (JsonParseException e) {
            throw new TreeReadException("Malformed syntax tree JSON: " + e.getMessage(), e);
        }
    }

    private static SyntaxNode toNode(JsonNode json, String origin) {
        if (json == null) {
            throw new TreeReadException("Syntax tree JSON is empty: " + origin);
        }
        if (json.type == null) {
            throw new TreeReadException("Syntax tree node without a type in " + origin);
        }
        SimpleSyntaxNode.Builder builder = SimpleSyntaxNode.builder(json.type)
                .text(json.text)
                .span(json.startPosition, json.endPosition);
        if (json.children != null) {
            for (JsonNode child : json.children) {
                builder.child(child.field, toNode(child, origin));
            }
        }
        return builder.build();
    }

    /** Gson target for one node of the dump. */
    static class JsonNode {
        String type;
        String text;
        String field;
        Position startPosition;
        Position endPosition;
        List<JsonNode> children;
    }

    public static class TreeReadException extends RuntimeException {
        public TreeReadException(String message) { super(message); }
        public TreeReadException(String message, Throwable cause) { super(message, cause); }
    }
}
