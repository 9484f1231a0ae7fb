package org.refactor.semantics.flow;

import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 对整个程序或单个函数做控制流 + 数据流分析。
 * <p>
 * 每次调用 {@link #analyze} 或 {@link #analyzeFunction} 都从头开始；最近一次的图保留给查询方法使用。
 * 非线程安全。
 */
public class FlowAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FlowAnalyzer.class);

    private ControlFlowGraph graph;

    public FlowAnalysisResult analyze(SyntaxNode root) {
        return analyze(root, FlowAnalysisOptions.defaults());
    }

    /**
     * 分析整个程序。这里不报告缺失的 return。
     */
    public FlowAnalysisResult analyze(SyntaxNode root, FlowAnalysisOptions options) {
        reset();
        CfgBuilder builder = new CfgBuilder(options);
        builder.buildProgram(root);
        return finish(root, builder, options);
    }

    public FlowAnalysisResult analyzeFunction(SyntaxNode function) {
        return analyzeFunction(function, FlowAnalysisOptions.defaults());
    }

    /**
     * 分析一个函数、方法、构造器或 lambda 节点。先绑定参数，再构建函数体。
     */
    public FlowAnalysisResult analyzeFunction(SyntaxNode function, FlowAnalysisOptions options) {
        reset();
        CfgBuilder builder = new CfgBuilder(options);
        builder.buildFunction(function);
        return finish(function, builder, options);
    }

    private FlowAnalysisResult finish(SyntaxNode root, CfgBuilder builder, FlowAnalysisOptions options) {
        builder.markReachable();
        ControlFlowGraph cfg = builder.toGraph();

        List<SourceLocation> unreachable = options.isDetectUnreachable() ? builder.unreachableCode() : List.of();

        DataFlowCollector collector = new DataFlowCollector(options, builder.getContextsByNode(), builder.getBindings());
        DataFlowInfo dataFlow = collector.collect(root, builder.getRootContext(), builder.getContexts());

        this.graph = cfg;
        log.debug("Analyzed {} at {}: {} nodes, {} edges, {} unreachable, {} infinite loop(s), {} missing return(s)",
                root.getType(), root.getStartPosition(), cfg.nodes.size(), cfg.edges.size(),
                unreachable.size(), builder.getInfiniteLoops().size(), builder.getMissingReturns().size());

        return new FlowAnalysisResult(cfg, dataFlow, unreachable,
                builder.getInfiniteLoops(), builder.getMissingReturns());
    }

    private void reset() {
        graph = null;
    }

    // ------------------------------------------------------------------
    // 查询最近一次生成的图
    // ------------------------------------------------------------------

    public List<CfgNode> getNodes() {
        return graph != null ? graph.nodes : List.of();
    }

    public List<CfgEdge> getEdges() {
        return graph != null ? graph.edges : List.of();
    }

    public boolean isNodeReachable(String nodeId) {
        CfgNode node = lookup(nodeId);
        return node != null && node.reachable;
    }

    public List<String> getPredecessors(String nodeId) {
        CfgNode node = lookup(nodeId);
        return node != null ? new ArrayList<>(node.incoming) : List.of();
    }

    public List<String> getSuccessors(String nodeId) {
        CfgNode node = lookup(nodeId);
        return node != null ? new ArrayList<>(node.outgoing) : List.of();
    }

    private CfgNode lookup(String nodeId) {
        return graph != null ? graph.getNode(nodeId) : null;
    }
}
