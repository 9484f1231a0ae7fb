package org.refactor.semantics.flow;

import org.refactor.semantics.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次分析中的变量访问记录以及数据流检查结果。
 */
public class DataFlowInfo {
    public List<DataFlowVariable> reads = new ArrayList<>();
    public List<DataFlowVariable> writes = new ArrayList<>();
    public List<DataFlowVariable> captures = new ArrayList<>();
    public List<SourceLocation> nullDereferences = new ArrayList<>();
    public List<String> unusedVariables = new ArrayList<>();
    public List<DataFlowVariable> uninitializedReads = new ArrayList<>();
}
