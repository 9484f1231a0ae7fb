package org.refactor.semantics.scope;

public enum ReferenceKind {
    READ,
    WRITE
}
