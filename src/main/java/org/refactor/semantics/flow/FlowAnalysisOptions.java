package org.refactor.semantics.flow;

/**
 * 流分析各项检查的开关，默认全部打开。也可以从 JSON 配置的 {@code flow} 段读取。
 */
public class FlowAnalysisOptions {

    private boolean detectUnreachable = true;
    private boolean detectInfiniteLoops = true;
    private boolean detectMissingReturns = true;
    private boolean detectNullDereferences = true;
    private boolean detectUnusedVariables = true;
    private boolean detectUninitializedReads = true;
    private Integer maxDepth;

    public static FlowAnalysisOptions defaults() {
        return new FlowAnalysisOptions();
    }

    public boolean isDetectUnreachable() { return detectUnreachable; }
    public boolean isDetectInfiniteLoops() { return detectInfiniteLoops; }
    public boolean isDetectMissingReturns() { return detectMissingReturns; }
    public boolean isDetectNullDereferences() { return detectNullDereferences; }
    public boolean isDetectUnusedVariables() { return detectUnusedVariables; }
    public boolean isDetectUninitializedReads() { return detectUninitializedReads; }

    /** CFG 构建的最大递归深度，超过后直接透传前驱；{@code null} 表示不限制。 */
    public Integer getMaxDepth() { return maxDepth; }

    public FlowAnalysisOptions detectUnreachable(boolean value) {
        this.detectUnreachable = value;
        return this;
    }

    public FlowAnalysisOptions detectInfiniteLoops(boolean value) {
        this.detectInfiniteLoops = value;
        return this;
    }

    public FlowAnalysisOptions detectMissingReturns(boolean value) {
        this.detectMissingReturns = value;
        return this;
    }

    public FlowAnalysisOptions detectNullDereferences(boolean value) {
        this.detectNullDereferences = value;
        return this;
    }

    public FlowAnalysisOptions detectUnusedVariables(boolean value) {
        this.detectUnusedVariables = value;
        return this;
    }

    public FlowAnalysisOptions detectUninitializedReads(boolean value) {
        this.detectUninitializedReads = value;
        return this;
    }

    public FlowAnalysisOptions maxDepth(Integer maxDepth) {
        this.maxDepth = maxDepth;
        return this;
    }
}
