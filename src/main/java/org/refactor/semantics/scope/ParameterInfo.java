package org.refactor.semantics.scope;

import org.refactor.semantics.tree.SourceLocation;

public record ParameterInfo(String name, boolean optional, boolean rest, SourceLocation location) {
}
