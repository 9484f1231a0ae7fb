package org.refactor.semantics.flow;

import org.refactor.semantics.tree.SourceLocation;

import java.util.List;

public class FlowAnalysisResult {
    public ControlFlowGraph controlFlow;
    public DataFlowInfo dataFlow;
    public List<SourceLocation> unreachableCode;
    public List<SourceLocation> infiniteLoops;
    public List<SourceLocation> missingReturns;

    public FlowAnalysisResult(ControlFlowGraph controlFlow, DataFlowInfo dataFlow,
                              List<SourceLocation> unreachableCode, List<SourceLocation> infiniteLoops,
                              List<SourceLocation> missingReturns) {
        this.controlFlow = controlFlow;
        this.dataFlow = dataFlow;
        this.unreachableCode = List.copyOf(unreachableCode);
        this.infiniteLoops = List.copyOf(infiniteLoops);
        this.missingReturns = List.copyOf(missingReturns);
    }
}
