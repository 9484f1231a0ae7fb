package org.refactor.semantics.flow;

import org.refactor.semantics.tree.SourceLocation;

public record DataFlowVariable(String name, SourceLocation location) {
}
