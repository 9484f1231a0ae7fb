package org.refactor.semantics.pattern;

import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;

import java.util.Map;

/**
 * One match of a pattern: the node, a confidence in [0, 1] and the named captures.
 */
public record PatternMatchResult(SyntaxNode node, double confidence,
                                 Map<String, SyntaxNode> captures, SourceLocation location) {
}
