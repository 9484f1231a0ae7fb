package org.refactor.semantics.pattern;

import org.refactor.semantics.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Declarative, immutable structural query. Every constraint is optional.
 * <p>
 * Type, text, child-count bounds and the predicate are hard requirements. Child sub-patterns
 * are searched among the direct children, or among all descendants when
 * {@code matchDescendants} is set.
 */
public final class AstPattern {

    private final String type;
    private final TextMatcher text;
    private final Integer minChildren;
    private final Integer maxChildren;
    private final List<AstPattern> children;
    private final boolean matchDescendants;
    private final Predicate<SyntaxNode> predicate;
    private final String capture;

    private AstPattern(Builder b) {
        this.type = b.type;
        this.text = b.text;
        this.minChildren = b.minChildren;
        this.maxChildren = b.maxChildren;
        this.children = Collections.unmodifiableList(new ArrayList<>(b.children));
        this.matchDescendants = b.matchDescendants;
        this.predicate = b.predicate;
        this.capture = b.capture;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for a pattern that only constrains the node type. */
    public static AstPattern ofType(String type) {
        return builder().type(type).build();
    }

    public String getType() { return type; }
    public TextMatcher getText() { return text; }
    public Integer getMinChildren() { return minChildren; }
    public Integer getMaxChildren() { return maxChildren; }
    public List<AstPattern> getChildren() { return children; }
    public boolean isMatchDescendants() { return matchDescendants; }
    public Predicate<SyntaxNode> getPredicate() { return predicate; }
    public String getCapture() { return capture; }

    public static final class Builder {
        private String type;
        private TextMatcher text;
        private Integer minChildren;
        private Integer maxChildren;
        private final List<AstPattern> children = new ArrayList<>();
        private boolean matchDescendants;
        private Predicate<SyntaxNode> predicate;
        private String capture;

        private Builder() {}

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder text(TextMatcher text) {
            this.text = text;
            return this;
        }

        /** Exact text equality. */
        public Builder text(String exactText) {
            this.text = TextMatcher.exact(exactText);
            return this;
        }

        public Builder minChildren(int minChildren) {
            this.minChildren = minChildren;
            return this;
        }

        public Builder maxChildren(int maxChildren) {
            this.maxChildren = maxChildren;
            return this;
        }

        public Builder child(AstPattern child) {
            this.children.add(child);
            return this;
        }

        public Builder children(List<AstPattern> children) {
            this.children.addAll(children);
            return this;
        }

        public Builder matchDescendants(boolean matchDescendants) {
            this.matchDescendants = matchDescendants;
            return this;
        }

        public Builder predicate(Predicate<SyntaxNode> predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder capture(String capture) {
            this.capture = capture;
            return this;
        }

        public AstPattern build() {
            return new AstPattern(this);
        }
    }
}
