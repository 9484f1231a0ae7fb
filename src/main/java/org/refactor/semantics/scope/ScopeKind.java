package org.refactor.semantics.scope;

public enum ScopeKind {
    GLOBAL,
    FUNCTION,
    BLOCK,
    CLASS,
    LOOP,
    CONDITIONAL,
    SWITCH,
    CATCH
}
