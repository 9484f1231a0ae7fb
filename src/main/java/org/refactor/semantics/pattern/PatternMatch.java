package org.refactor.semantics.pattern;

import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;

/**
 * A match tagged with the id of the pattern that produced it.
 */
public class PatternMatch {
    public String patternId;
    public SourceLocation location;
    public double confidence;
    public boolean isOutlier;

    public transient SyntaxNode node;

    public PatternMatch(String patternId, PatternMatchResult result) {
        this.patternId = patternId;
        this.location = result.location();
        this.confidence = result.confidence();
        this.isOutlier = false;
        this.node = result.node();
    }
}
