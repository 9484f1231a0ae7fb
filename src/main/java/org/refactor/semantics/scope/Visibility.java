package org.refactor.semantics.scope;

public enum Visibility {
    DEFAULT,
    PUBLIC,
    PRIVATE,
    PROTECTED
}
