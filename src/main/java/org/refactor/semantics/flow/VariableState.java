package org.refactor.semantics.flow;

import org.refactor.semantics.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link FlowContext} 中一个变量绑定的数据流状态。
 */
public class VariableState {
    public String name;
    public boolean initialized;
    public boolean read;
    public boolean written;
    public boolean captured;          // 被嵌套函数访问
    public SourceLocation declarationLocation;
    public List<SourceLocation> readLocations = new ArrayList<>();
    public List<SourceLocation> writeLocations = new ArrayList<>();

    public VariableState(String name, SourceLocation declarationLocation) {
        this.name = name;
        this.declarationLocation = declarationLocation;
    }

    /** 带初始值的声明：在声明处写入一次。 */
    public static VariableState initializedAt(String name, SourceLocation location) {
        VariableState state = new VariableState(name, location);
        state.initialized = true;
        state.written = true;
        state.writeLocations.add(location);
        return state;
    }

    /** 参数、catch 参数和循环变量：由运行时绑定，不算“写”。 */
    public static VariableState bound(String name, SourceLocation location) {
        VariableState state = new VariableState(name, location);
        state.initialized = true;
        return state;
    }

    /** 写过但从未读过。被嵌套函数捕获不算读。 */
    public boolean isUnused() {
        return written && !read;
    }

    @Override
    public String toString() {
        return name + "[init=" + initialized + ", read=" + read + ", written=" + written
                + ", captured=" + captured + "]";
    }
}
