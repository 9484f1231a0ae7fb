package org.refactor.semantics.pattern;

public enum DifferenceType {
    TYPE_MISMATCH,
    TEXT_MISMATCH,
    CHILDREN_COUNT,
    MISSING_CHILD,
    EXTRA_CHILD
}
