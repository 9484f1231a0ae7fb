package org.refactor.semantics.tree;

import java.util.List;

/**
 * Read-only view of one node of an already-parsed syntax tree.
 * <p>
 * The analyzers never mutate or copy nodes; they only hold references to them. Node types are
 * parser tags such as {@code if_statement} or {@code identifier} (tree-sitter naming), and
 * {@link #getChildForFieldName(String)} exposes the grammar's field names ({@code condition},
 * {@code body}, {@code name}, ...). Implementations return an empty list rather than
 * {@code null} for leaves.
 */
public interface SyntaxNode {

    String getType();

    String getText();

    Position getStartPosition();

    Position getEndPosition();

    List<SyntaxNode> getChildren();

    /**
     * @param fieldName grammar field name
     * @return the child bound to that field, or {@code null} when the grammar has no such field
     *         for this node or the field is empty
     */
    SyntaxNode getChildForFieldName(String fieldName);

    default int getChildCount() {
        return getChildren().size();
    }

    default SourceLocation getLocation() {
        return SourceLocation.of(this);
    }
}
