package org.refactor.semantics.scope;

import org.refactor.semantics.tree.SourceLocation;

/**
 * One use of a name: resolved (attached to its {@link SymbolInfo}) or unresolved.
 */
public record SymbolReference(String name, SourceLocation location, ReferenceKind kind, boolean write) {

    public static SymbolReference read(String name, SourceLocation location) {
        return new SymbolReference(name, location, ReferenceKind.READ, false);
    }

    public static SymbolReference write(String name, SourceLocation location) {
        return new SymbolReference(name, location, ReferenceKind.WRITE, true);
    }
}
