package org.refactor.semantics.pattern;

import org.refactor.semantics.tree.Position;

/**
 * Traversal options for {@link PatternMatcher#findPattern}.
 */
public class PatternMatchOptions {

    private Integer limit;
    private boolean includeNested = true;
    private Position startPosition;
    private Position endPosition;
    private double minConfidence = 0;

    public static PatternMatchOptions defaults() {
        return new PatternMatchOptions();
    }

    public Integer getLimit() { return limit; }
    public boolean isIncludeNested() { return includeNested; }
    public Position getStartPosition() { return startPosition; }
    public Position getEndPosition() { return endPosition; }
    public double getMinConfidence() { return minConfidence; }

    /** Stop after this many matches. */
    public PatternMatchOptions limit(int limit) {
        this.limit = limit;
        return this;
    }

    /** When {@code false}, the children of a matched node are not searched. */
    public PatternMatchOptions includeNested(boolean includeNested) {
        this.includeNested = includeNested;
        return this;
    }

    /** Only nodes starting at or after this position are candidates. */
    public PatternMatchOptions startPosition(Position startPosition) {
        this.startPosition = startPosition;
        return this;
    }

    /** Only nodes ending at or before this position are candidates. */
    public PatternMatchOptions endPosition(Position endPosition) {
        this.endPosition = endPosition;
        return this;
    }

    public PatternMatchOptions minConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
        return this;
    }
}
