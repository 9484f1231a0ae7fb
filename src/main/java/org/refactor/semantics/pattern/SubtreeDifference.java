package org.refactor.semantics.pattern;

import org.refactor.semantics.tree.SyntaxNode;

import java.util.List;

/**
 * A single difference found while comparing two subtrees. Paths are child-index paths from
 * the compared roots; {@code node1}/{@code node2} may be null for missing or extra children.
 */
public class SubtreeDifference {
    public DifferenceType type;
    public List<Integer> path1;
    public List<Integer> path2;
    public String description;

    public transient SyntaxNode node1;
    public transient SyntaxNode node2;

    public SubtreeDifference(DifferenceType type, List<Integer> path1, List<Integer> path2,
                             String description, SyntaxNode node1, SyntaxNode node2) {
        this.type = type;
        this.path1 = List.copyOf(path1);
        this.path2 = List.copyOf(path2);
        this.description = description;
        this.node1 = node1;
        this.node2 = node2;
    }

    @Override
    public String toString() {
        return type + " at " + path1 + "/" + path2 + ": " + description;
    }
}
