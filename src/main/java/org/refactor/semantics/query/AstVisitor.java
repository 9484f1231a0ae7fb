package org.refactor.semantics.query;

import org.refactor.semantics.tree.SyntaxNode;

import java.util.List;

/**
 * Callback for {@link AstQuery#traverse(SyntaxNode, AstVisitor)}.
 */
@FunctionalInterface
public interface AstVisitor {

    /**
     * @param node   current node
     * @param parent parent node, {@code null} for the root
     * @param depth  0 for the root
     * @param path   child indexes from the root to {@code node}
     * @return {@code false} to stop the whole traversal
     */
    boolean visit(SyntaxNode node, SyntaxNode parent, int depth, List<Integer> path);
}
