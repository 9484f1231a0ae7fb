package org.refactor.semantics.scope;

public enum SymbolKind {
    VARIABLE,
    FUNCTION,
    PARAMETER,
    CLASS,
    METHOD,
    PROPERTY,
    INTERFACE,
    TYPE,
    ENUM,
    ENUM_MEMBER,
    NAMESPACE
}
