package org.refactor.semantics.query;

import org.refactor.semantics.tree.Position;
import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Generic depth-first queries over a {@link SyntaxNode} tree. Stateless; safe to share.
 */
public final class AstQuery {

    /**
     * Depth-first, pre-order traversal. A visitor returning {@code false} stops everything,
     * not just the current subtree.
     */
    public void traverse(SyntaxNode root, AstVisitor visitor) {
        traverseNode(root, null, 0, new ArrayList<>(), visitor);
    }

    private boolean traverseNode(SyntaxNode node, SyntaxNode parent, int depth,
                                 List<Integer> path, AstVisitor visitor) {
        if (!visitor.visit(node, parent, depth, Collections.unmodifiableList(path))) {
            return false;
        }
        List<SyntaxNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            path.add(i);
            boolean keepGoing = traverseNode(children.get(i), node, depth + 1, path, visitor);
            path.remove(path.size() - 1);
            if (!keepGoing) {
                return false;
            }
        }
        return true;
    }

    public List<SyntaxNode> findNodesByType(SyntaxNode root, String nodeType) {
        List<SyntaxNode> results = new ArrayList<>();
        traverse(root, (node, parent, depth, path) -> {
            if (node.getType().equals(nodeType)) {
                results.add(node);
            }
            return true;
        });
        return results;
    }

    /** @return the first node of {@code nodeType} in pre-order, or {@code null} */
    public SyntaxNode findFirstNodeByType(SyntaxNode root, String nodeType) {
        SyntaxNode[] found = new SyntaxNode[1];
        traverse(root, (node, parent, depth, path) -> {
            if (node.getType().equals(nodeType)) {
                found[0] = node;
                return false;
            }
            return true;
        });
        return found[0];
    }

    /** @return the deepest node whose span contains {@code position}, or {@code null} */
    public SyntaxNode findNodeAtPosition(SyntaxNode root, Position position) {
        SyntaxNode[] found = new SyntaxNode[1];
        traverse(root, (node, parent, depth, path) -> {
            if (SourceLocation.of(node).contains(position)) {
                found[0] = node;
            }
            return true;
        });
        return found[0];
    }

    public List<SyntaxNode> getDescendants(SyntaxNode node) {
        List<SyntaxNode> descendants = new ArrayList<>();
        collectDescendants(node, descendants);
        return descendants;
    }

    private void collectDescendants(SyntaxNode node, List<SyntaxNode> out) {
        for (SyntaxNode child : node.getChildren()) {
            out.add(child);
            collectDescendants(child, out);
        }
    }

    /** @return depth of {@code target} (0 for the root), or -1 when it is not in the tree */
    public int getNodeDepth(SyntaxNode root, SyntaxNode target) {
        int[] found = {-1};
        traverse(root, (node, parent, depth, path) -> {
            if (node == target) {
                found[0] = depth;
                return false;
            }
            return true;
        });
        return found[0];
    }

    /**
     * Ancestors of {@code target}, ordered root first and ending with its immediate parent.
     * Empty for the root itself or for a node that is not in the tree.
     */
    public List<SyntaxNode> getParentChain(SyntaxNode root, SyntaxNode target) {
        List<SyntaxNode> chain = new ArrayList<>();
        if (findParents(root, target, chain)) {
            return chain;
        }
        return new ArrayList<>();
    }

    private boolean findParents(SyntaxNode node, SyntaxNode target, List<SyntaxNode> chain) {
        if (node == target) {
            return true;
        }
        chain.add(node);
        for (SyntaxNode child : node.getChildren()) {
            if (findParents(child, target, chain)) {
                return true;
            }
        }
        chain.remove(chain.size() - 1);
        return false;
    }

    public boolean isLeafNode(SyntaxNode node) {
        return node.getChildren().isEmpty();
    }

    public AstStats getStats(SyntaxNode root) {
        Map<String, Integer> nodesByType = new TreeMap<>();
        int[] nodeCount = {0};
        int[] maxDepth = {0};
        int[] totalChildren = {0};
        int[] nonLeafNodes = {0};

        traverse(root, (node, parent, depth, path) -> {
            nodeCount[0]++;
            maxDepth[0] = Math.max(maxDepth[0], depth);
            nodesByType.merge(node.getType(), 1, Integer::sum);
            int children = node.getChildren().size();
            if (children > 0) {
                totalChildren[0] += children;
                nonLeafNodes[0]++;
            }
            return true;
        });

        double avgChildren = nonLeafNodes[0] > 0 ? (double) totalChildren[0] / nonLeafNodes[0] : 0;
        return new AstStats(nodeCount[0], nodesByType, maxDepth[0], avgChildren);
    }
}
