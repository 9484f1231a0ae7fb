package org.refactor.semantics.pattern;

import org.refactor.semantics.query.AstQuery;
import org.refactor.semantics.query.AstStats;
import org.refactor.semantics.tree.Position;
import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Confidence-scored structural matching of {@link AstPattern}s against a tree.
 * <p>
 * Scoring: any failing hard check (type, text, child-count bounds, predicate) yields 0. When
 * child sub-patterns are present the score is multiplied by the fraction of them that were
 * satisfied; a sub-pattern with no satisfying node fails the candidate outright.
 */
public class PatternMatcher {

    private static final Logger log = LoggerFactory.getLogger(PatternMatcher.class);

    private final AstQuery query = new AstQuery();

    public List<PatternMatchResult> findPattern(SyntaxNode root, AstPattern pattern) {
        return findPattern(root, pattern, PatternMatchOptions.defaults());
    }

    public List<PatternMatchResult> findPattern(SyntaxNode root, AstPattern pattern, PatternMatchOptions options) {
        List<PatternMatchResult> results = new ArrayList<>();
        search(root, pattern, options, results);
        log.debug("Pattern {} matched {} node(s)", describe(pattern), results.size());
        return results;
    }

    /**
     * @return {@code false} once the match limit is reached
     */
    private boolean search(SyntaxNode node, AstPattern pattern, PatternMatchOptions options,
                           List<PatternMatchResult> results) {
        boolean inBounds = withinBounds(node, options.getStartPosition(), options.getEndPosition());
        boolean matched = false;

        if (inBounds) {
            Map<String, SyntaxNode> captures = new LinkedHashMap<>();
            double confidence = matchPattern(node, pattern, captures);
            if (confidence > 0 && confidence >= options.getMinConfidence()) {
                results.add(new PatternMatchResult(node, confidence, captures, SourceLocation.of(node)));
                matched = true;
                Integer limit = options.getLimit();
                if (limit != null && results.size() >= limit) {
                    return false;
                }
            }
        }

        if (matched && !options.isIncludeNested()) {
            return true;
        }
        for (SyntaxNode child : node.getChildren()) {
            if (!search(child, pattern, options, results)) {
                return false;
            }
        }
        return true;
    }

    private boolean withinBounds(SyntaxNode node, Position start, Position end) {
        if (start != null && !node.getStartPosition().isAtOrAfter(start)) {
            return false;
        }
        return end == null || node.getEndPosition().isAtOrBefore(end);
    }

    /**
     * Scores {@code node} against {@code pattern}, recording captures on success.
     *
     * @return confidence in [0, 1]; 0 means no match
     */
    public double matchPattern(SyntaxNode node, AstPattern pattern, Map<String, SyntaxNode> captures) {
        if (pattern.getType() != null && !pattern.getType().equals(node.getType())) {
            return 0;
        }
        if (pattern.getText() != null && !pattern.getText().matches(node.getText())) {
            return 0;
        }
        int childCount = node.getChildren().size();
        if (pattern.getMinChildren() != null && childCount < pattern.getMinChildren()) {
            return 0;
        }
        if (pattern.getMaxChildren() != null && childCount > pattern.getMaxChildren()) {
            return 0;
        }
        if (pattern.getPredicate() != null && !pattern.getPredicate().test(node)) {
            return 0;
        }

        double score = 1.0;
        if (!pattern.getChildren().isEmpty()) {
            double childScore = matchChildPatterns(node, pattern, captures);
            if (childScore == 0) {
                return 0;
            }
            score *= childScore;
        }

        if (pattern.getCapture() != null) {
            captures.put(pattern.getCapture(), node);
        }
        return score;
    }

    private double matchChildPatterns(SyntaxNode node, AstPattern pattern, Map<String, SyntaxNode> captures) {
        List<SyntaxNode> candidates = pattern.isMatchDescendants()
                ? query.getDescendants(node)
                : node.getChildren();
        int matched = 0;

        for (AstPattern childPattern : pattern.getChildren()) {
            boolean found = false;
            for (SyntaxNode candidate : candidates) {
                Map<String, SyntaxNode> childCaptures = new LinkedHashMap<>();
                if (matchPattern(candidate, childPattern, childCaptures) > 0) {
                    captures.putAll(childCaptures);
                    matched++;
                    found = true;
                    break;
                }
            }
            if (!found) {
                return 0;
            }
        }
        return (double) matched / pattern.getChildren().size();
    }

    /**
     * Runs every pattern over the tree and reports all matches together with the tree stats.
     */
    public AstAnalysisResult analyze(SyntaxNode root, Map<String, AstPattern> patterns) {
        List<PatternMatch> matches = new ArrayList<>();
        AstStats stats = query.getStats(root);
        for (Map.Entry<String, AstPattern> entry : patterns.entrySet()) {
            for (PatternMatchResult result : findPattern(root, entry.getValue())) {
                matches.add(new PatternMatch(entry.getKey(), result));
            }
        }
        return new AstAnalysisResult(matches, stats);
    }

    private static String describe(AstPattern pattern) {
        if (pattern.getType() != null) {
            return pattern.getType();
        }
        return pattern.getText() != null ? pattern.getText().toString() : "<any>";
    }
}
