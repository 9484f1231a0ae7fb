package org.refactor.semantics.scope;

import org.refactor.semantics.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * A declared name in one scope.
 */
public class SymbolInfo {
    public String name;
    public SymbolKind kind;
    public SourceLocation location;
    public String scopeId;
    public Visibility visibility = Visibility.DEFAULT;
    public boolean exported;
    public boolean imported;
    public List<ParameterInfo> parameters;          // functions and methods only
    public List<SymbolReference> references = new ArrayList<>();

    public SymbolInfo(String name, SymbolKind kind, String scopeId, SourceLocation location) {
        this.name = name;
        this.kind = kind;
        this.scopeId = scopeId;
        this.location = location;
    }

    @Override
    public String toString() {
        return scopeId + ":" + name + "(" + kind + ")";
    }
}
