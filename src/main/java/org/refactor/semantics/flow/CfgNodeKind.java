package org.refactor.semantics.flow;

public enum CfgNodeKind {
    ENTRY,
    EXIT,
    STATEMENT,
    BRANCH,
    MERGE,
    LOOP,
    RETURN,
    THROW,
    BREAK,
    CONTINUE;

    /** 辅助节点不算作不可达代码。 */
    public boolean isScaffolding() {
        return this == ENTRY || this == EXIT || this == MERGE;
    }
}
