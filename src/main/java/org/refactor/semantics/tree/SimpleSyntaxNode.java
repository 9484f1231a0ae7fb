package org.refactor.semantics.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable in-memory {@link SyntaxNode}. Used by the Java front end, the JSON reader and tests.
 */
public final class SimpleSyntaxNode implements SyntaxNode {

    private final String type;
    private final String text;
    private final Position start;
    private final Position end;
    private final List<SyntaxNode> children;
    private final Map<String, SyntaxNode> fields;

    private SimpleSyntaxNode(Builder b) {
        this.type = b.type;
        this.text = b.text != null ? b.text : "";
        this.start = b.start != null ? b.start : Position.ORIGIN;
        this.end = b.end != null ? b.end : this.start;
        this.children = Collections.unmodifiableList(new ArrayList<>(b.children));
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(b.fields));
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    @Override
    public String getType() { return type; }

    @Override
    public String getText() { return text; }

    @Override
    public Position getStartPosition() { return start; }

    @Override
    public Position getEndPosition() { return end; }

    @Override
    public List<SyntaxNode> getChildren() { return children; }

    @Override
    public SyntaxNode getChildForFieldName(String fieldName) {
        return fields.get(fieldName);
    }

    @Override
    public String toString() {
        return type + "@" + start + "-" + end;
    }

    public static final class Builder {
        private final String type;
        private String text;
        private Position start;
        private Position end;
        private final List<SyntaxNode> children = new ArrayList<>();
        private final Map<String, SyntaxNode> fields = new LinkedHashMap<>();

        private Builder(String type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder span(Position start, Position end) {
            this.start = start;
            this.end = end;
            return this;
        }

        public Builder child(SyntaxNode child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        /** Adds {@code child} and binds it to a grammar field; the first binding of a field wins. */
        public Builder child(String fieldName, SyntaxNode child) {
            child(child);
            if (fieldName != null) {
                fields.putIfAbsent(fieldName, child);
            }
            return this;
        }

        public SimpleSyntaxNode build() {
            return new SimpleSyntaxNode(this);
        }
    }
}
