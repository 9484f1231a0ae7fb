package org.refactor.semantics.scope;

import org.refactor.semantics.tree.SourceLocation;

import java.util.List;

/**
 * Read-only view of a scope: its place in the scope tree and the names it declares.
 */
public record ScopeInfo(String id, ScopeKind kind, String parentId, List<String> childIds,
                        List<String> symbols, SourceLocation location, int depth) {
}
