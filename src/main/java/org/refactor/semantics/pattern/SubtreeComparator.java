package org.refactor.semantics.pattern;

import org.refactor.semantics.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional, recursive comparison of two subtrees.
 * <p>
 * A pair scores 1, multiplied by 0.5 on a type mismatch and by 0.8 on a text mismatch,
 * then by the average similarity of its children paired by index. A child present on only
 * one side contributes 0 to that average: it is an extra child when only the first tree has
 * it, a missing child when only the second does. A pair where either type is ignored matches.
 */
public class SubtreeComparator {

    private static final Logger log = LoggerFactory.getLogger(SubtreeComparator.class);

    static final double TYPE_MISMATCH_PENALTY = 0.5;
    static final double TEXT_MISMATCH_PENALTY = 0.8;

    public SubtreeCompareResult compareSubtrees(SyntaxNode first, SyntaxNode second) {
        return compareSubtrees(first, second, SubtreeCompareOptions.defaults());
    }

    public SubtreeCompareResult compareSubtrees(SyntaxNode first, SyntaxNode second, SubtreeCompareOptions options) {
        Comparison comparison = new Comparison(options);
        double similarity = comparison.compare(first, second, new ArrayList<>(), new ArrayList<>(), 0);
        SubtreeCompareResult result = new SubtreeCompareResult(similarity, comparison.differences,
                new SubtreeCompareResult.Stats(comparison.nodesCompared, comparison.matchingNodes,
                        comparison.differentNodes));
        log.debug("Compared {} with {}: similarity={}, {} difference(s)",
                first.getType(), second.getType(), similarity, result.differences.size());
        return result;
    }

    /** State of one comparison run. */
    private static class Comparison {
        final SubtreeCompareOptions options;
        final List<SubtreeDifference> differences = new ArrayList<>();
        int nodesCompared;
        int matchingNodes;
        int differentNodes;

        Comparison(SubtreeCompareOptions options) {
            this.options = options;
        }

        double compare(SyntaxNode a, SyntaxNode b, List<Integer> path1, List<Integer> path2, int depth) {
            Integer maxDepth = options.getMaxDepth();
            if (maxDepth != null && depth > maxDepth) {
                return 1.0;
            }
            nodesCompared++;

            if (options.getIgnoreTypes().contains(a.getType()) || options.getIgnoreTypes().contains(b.getType())) {
                matchingNodes++;
                return 1.0;
            }

            double similarity = 1.0;
            boolean different = false;

            if (!a.getType().equals(b.getType())) {
                differences.add(new SubtreeDifference(DifferenceType.TYPE_MISMATCH, path1, path2,
                        "Type mismatch: " + a.getType() + " vs " + b.getType(), a, b));
                similarity *= TYPE_MISMATCH_PENALTY;
                different = true;
            }

            if (!options.isIgnoreText() && !a.getText().equals(b.getText())) {
                differences.add(new SubtreeDifference(DifferenceType.TEXT_MISMATCH, path1, path2,
                        "Text mismatch: \"" + abbreviate(a.getText()) + "\" vs \"" + abbreviate(b.getText()) + "\"",
                        a, b));
                similarity *= TEXT_MISMATCH_PENALTY;
                different = true;
            }

            List<SyntaxNode> left = a.getChildren();
            List<SyntaxNode> right = b.getChildren();
            if (left.size() != right.size()) {
                differences.add(new SubtreeDifference(DifferenceType.CHILDREN_COUNT, path1, path2,
                        "Children count: " + left.size() + " vs " + right.size(), a, b));
                different = true;
            }

            if (different) {
                differentNodes++;
            } else {
                matchingNodes++;
            }

            int childCount = Math.max(left.size(), right.size());
            if (childCount == 0) {
                return similarity;
            }

            double childSum = 0;
            for (int i = 0; i < childCount; i++) {
                if (i < left.size() && i < right.size()) {
                    childSum += compare(left.get(i), right.get(i), append(path1, i), append(path2, i), depth + 1);
                } else if (i < left.size()) {
                    differences.add(new SubtreeDifference(DifferenceType.EXTRA_CHILD, append(path1, i), path2,
                            "Extra child " + left.get(i).getType() + " in first tree at index " + i, left.get(i), null));
                } else {
                    differences.add(new SubtreeDifference(DifferenceType.MISSING_CHILD, path1, append(path2, i),
                            "Child " + right.get(i).getType() + " missing in first tree at index " + i, null, right.get(i)));
                }
            }
            return similarity * (childSum / childCount);
        }

        private static List<Integer> append(List<Integer> path, int index) {
            List<Integer> next = new ArrayList<>(path.size() + 1);
            next.addAll(path);
            next.add(index);
            return next;
        }

        private static String abbreviate(String text) {
            return text.length() > 40 ? text.substring(0, 37) + "..." : text;
        }
    }
}
