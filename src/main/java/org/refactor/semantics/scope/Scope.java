package org.refactor.semantics.scope;

import org.refactor.semantics.tree.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable scope used while analyzing. Re-declaring a name in the same scope replaces the
 * earlier symbol.
 */
class Scope {
    final String id;
    final ScopeKind kind;
    final String parentId;
    final List<String> childIds = new ArrayList<>();
    final Map<String, SymbolInfo> symbols = new LinkedHashMap<>();
    final SourceLocation location;
    final int depth;

    Scope(String id, ScopeKind kind, String parentId, SourceLocation location, int depth) {
        this.id = id;
        this.kind = kind;
        this.parentId = parentId;
        this.location = location;
        this.depth = depth;
    }

    ScopeInfo toInfo() {
        return new ScopeInfo(id, kind, parentId, List.copyOf(childIds),
                List.copyOf(symbols.keySet()), location, depth);
    }
}
