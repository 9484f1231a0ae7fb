package org.refactor.semantics.pattern;

import java.util.List;

public class SubtreeCompareResult {
    public boolean identical;
    public double similarity;
    public List<SubtreeDifference> differences;
    public Stats stats;

    public SubtreeCompareResult(double similarity, List<SubtreeDifference> differences, Stats stats) {
        this.similarity = similarity;
        this.differences = List.copyOf(differences);
        this.stats = stats;
        this.identical = differences.isEmpty() && similarity == 1.0;
    }

    public record Stats(int nodesCompared, int matchingNodes, int differentNodes) {
    }
}
