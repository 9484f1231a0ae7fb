package org.refactor.semantics.flow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个程序或函数的控制流图：一个入口，一个或多个出口，节点按创建顺序，边按加入顺序。
 */
public class ControlFlowGraph {
    public CfgNode entry;
    public List<CfgNode> exits;
    public List<CfgNode> nodes;
    public List<CfgEdge> edges;

    // id -> 节点，不输出 JSON
    private final transient Map<String, CfgNode> index = new LinkedHashMap<>();

    public ControlFlowGraph(CfgNode entry, List<CfgNode> exits, List<CfgNode> nodes, List<CfgEdge> edges) {
        this.entry = entry;
        this.exits = List.copyOf(exits);
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        for (CfgNode node : nodes) {
            index.put(node.id, node);
        }
    }

    public CfgNode getNode(String id) {
        return index.get(id);
    }

    public List<CfgNode> nodesOfKind(CfgNodeKind kind) {
        return nodes.stream().filter(n -> n.kind == kind).toList();
    }
}
