package org.refactor.semantics.scope;

import org.refactor.semantics.tree.SourceLocation;

/**
 * An inner declaration hiding a same-named declaration of an enclosing scope.
 */
public record ShadowedVariable(String name, SourceLocation shadowLocation, SourceLocation originalLocation) {
}
