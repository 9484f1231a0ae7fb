package org.refactor.semantics.query;

import java.util.Map;

/**
 * Shape statistics of a tree. {@code avgChildren} averages over non-leaf nodes only.
 */
public record AstStats(int nodeCount, Map<String, Integer> nodesByType, int maxDepth, double avgChildren) {
}
