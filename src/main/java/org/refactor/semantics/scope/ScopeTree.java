package org.refactor.semantics.scope;

import org.refactor.semantics.tree.Position;
import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The scopes of one analysis, rooted at a single global scope. Depth is 0 at the root and
 * grows by one per level.
 */
class ScopeTree {

    private final Map<String, Scope> scopes = new LinkedHashMap<>();
    private final Map<SyntaxNode, Scope> scopesByNode = new IdentityHashMap<>();
    private final List<ShadowedVariable> shadowedVariables = new ArrayList<>();
    private final boolean detectShadowing;
    private int idCounter = 0;

    ScopeTree(boolean detectShadowing) {
        this.detectShadowing = detectShadowing;
    }

    /**
     * @param owner the node that introduces the scope, used by reference resolution; may be null
     */
    Scope create(ScopeKind kind, String parentId, SourceLocation location, SyntaxNode owner) {
        Scope parent = parentId != null ? scopes.get(parentId) : null;
        Scope scope = new Scope("scope_" + idCounter++, kind, parent != null ? parent.id : null, location,
                parent != null ? parent.depth + 1 : 0);
        scopes.put(scope.id, scope);
        if (parent != null) {
            parent.childIds.add(scope.id);
        }
        if (owner != null) {
            scopesByNode.put(owner, scope);
        }
        return scope;
    }

    /** Routes reference resolution entering {@code node} to an existing scope. */
    void alias(SyntaxNode node, Scope scope) {
        scopesByNode.put(node, scope);
    }

    Scope get(String id) {
        return id != null ? scopes.get(id) : null;
    }

    Scope scopeOf(SyntaxNode node) {
        return scopesByNode.get(node);
    }

    Collection<Scope> all() {
        return Collections.unmodifiableCollection(scopes.values());
    }

    /**
     * Inserts {@code symbol} into its scope. With shadowing detection on, the name is first
     * resolved from the parent scope; a hit is recorded as a {@link ShadowedVariable}.
     */
    void addSymbol(SymbolInfo symbol) {
        Scope scope = scopes.get(symbol.scopeId);
        if (scope == null) {
            return;
        }
        if (detectShadowing && scope.parentId != null) {
            SymbolInfo outer = resolve(symbol.name, scope.parentId);
            if (outer != null && !outer.scopeId.equals(scope.id)) {
                shadowedVariables.add(new ShadowedVariable(symbol.name, symbol.location, outer.location));
            }
        }
        scope.symbols.put(symbol.name, symbol);
    }

    SymbolInfo resolve(String name, String scopeId) {
        for (Scope scope = get(scopeId); scope != null; scope = get(scope.parentId)) {
            SymbolInfo symbol = scope.symbols.get(name);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }

    /** Innermost definition wins on name collisions. */
    Map<String, SymbolInfo> visible(String scopeId) {
        Map<String, SymbolInfo> visible = new LinkedHashMap<>();
        for (Scope scope = get(scopeId); scope != null; scope = get(scope.parentId)) {
            for (Map.Entry<String, SymbolInfo> entry : scope.symbols.entrySet()) {
                visible.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
        return visible;
    }

    /** Deepest scope whose location contains {@code position}; the first created wins a tie. */
    Scope deepestAt(Position position) {
        Scope result = null;
        for (Scope scope : scopes.values()) {
            if (scope.location.contains(position) && (result == null || scope.depth > result.depth)) {
                result = scope;
            }
        }
        return result;
    }

    List<ShadowedVariable> getShadowedVariables() {
        return shadowedVariables;
    }
}
