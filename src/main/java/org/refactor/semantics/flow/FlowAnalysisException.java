package org.refactor.semantics.flow;

/**
 * CFG 构建内部状态出错。输入不完整时不会抛出。
 */
public class FlowAnalysisException extends RuntimeException {

    public FlowAnalysisException(String message) {
        super(message);
    }
}
