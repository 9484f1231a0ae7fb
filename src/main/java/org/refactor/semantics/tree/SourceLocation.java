package org.refactor.semantics.tree;

/**
 * Start/end span of a construct. Both ends are inclusive for containment checks.
 */
public record SourceLocation(Position start, Position end) {

    public static SourceLocation of(SyntaxNode node) {
        return new SourceLocation(node.getStartPosition(), node.getEndPosition());
    }

    /** Zero-width location at the start of {@code node}. */
    public static SourceLocation startOf(SyntaxNode node) {
        return new SourceLocation(node.getStartPosition(), node.getStartPosition());
    }

    /** Zero-width location at the end of {@code node}. */
    public static SourceLocation endOf(SyntaxNode node) {
        return new SourceLocation(node.getEndPosition(), node.getEndPosition());
    }

    public boolean contains(Position position) {
        return position.isAtOrAfter(start) && position.isAtOrBefore(end);
    }

    public boolean sameSpan(SyntaxNode node) {
        return start.equals(node.getStartPosition()) && end.equals(node.getEndPosition());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
