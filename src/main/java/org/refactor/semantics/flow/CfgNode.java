package org.refactor.semantics.flow;

import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@link ControlFlowGraph} 中的一个控制点。
 */
public class CfgNode {
    public String id;                 // cfg_N，一次分析内唯一
    public CfgNodeKind kind;
    public SourceLocation location;
    public Set<String> outgoing = new LinkedHashSet<>();
    public Set<String> incoming = new LinkedHashSet<>();
    public boolean reachable;

    // 辅助节点（entry、exit、merge）没有语法节点；不输出 JSON
    public transient SyntaxNode syntaxNode;

    public CfgNode(String id, CfgNodeKind kind, SourceLocation location, SyntaxNode syntaxNode) {
        this.id = id;
        this.kind = kind;
        this.location = location;
        this.syntaxNode = syntaxNode;
    }

    @Override
    public String toString() {
        return id + "(" + kind + ")";
    }
}
