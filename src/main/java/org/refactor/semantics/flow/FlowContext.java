package org.refactor.semantics.flow;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CFG 构建的上下文：当前可见的变量，以及外层循环、switch 的跳转目标。
 * <p>
 * 上下文通过 {@link #getParent()} 串成链。每个派生上下文有自己的变量表，
 * 循环、switch、try、catch 内的声明不会泄漏到外层。函数上下文是边界：
 * 只能在边界之外找到的变量算闭包捕获，而不是本地访问。
 */
public class FlowContext {

    private final Map<String, VariableState> variables = new LinkedHashMap<>();
    private final FlowContext parent;
    private final boolean functionBoundary;
    private final boolean inLoop;
    private final boolean inTry;
    private final String loopEntry;
    private final String loopExit;
    private final String switchExit;

    private FlowContext(FlowContext parent, boolean functionBoundary, boolean inLoop, boolean inTry,
                        String loopEntry, String loopExit, String switchExit) {
        this.parent = parent;
        this.functionBoundary = functionBoundary;
        this.inLoop = inLoop;
        this.inTry = inTry;
        this.loopEntry = loopEntry;
        this.loopExit = loopExit;
        this.switchExit = switchExit;
    }

    public static FlowContext root() {
        return new FlowContext(null, true, false, false, null, null, null);
    }

    /** 循环体：{@code break} 跳到循环出口，{@code continue} 跳回循环头。 */
    public FlowContext forLoop(String entryId, String exitId) {
        return new FlowContext(this, false, true, inTry, entryId, exitId, null);
    }

    /** switch 体：{@code break} 跳到 switch 出口，{@code continue} 仍指向外层循环。 */
    public FlowContext forSwitch(String exitId) {
        return new FlowContext(this, false, inLoop, inTry, loopEntry, loopExit, exitId);
    }

    public FlowContext forTry() {
        return new FlowContext(this, false, inLoop, true, loopEntry, loopExit, switchExit);
    }

    public FlowContext forCatch() {
        return new FlowContext(this, false, inLoop, inTry, loopEntry, loopExit, switchExit);
    }

    /** 嵌套函数或闭包：外层跳转目标不会带进来。 */
    public FlowContext forFunction() {
        return new FlowContext(this, true, false, false, null, null, null);
    }

    /** 在当前上下文绑定 {@code state}；同名变量以后声明的为准。 */
    public void declare(VariableState state) {
        variables.put(state.name, state);
    }

    /**
     * 沿上下文链查找 {@code name}。
     *
     * @return 找到的绑定；整条链都没有声明时返回 {@code null}
     */
    public Binding resolve(String name) {
        boolean crossedBoundary = false;
        for (FlowContext current = this; current != null; current = current.parent) {
            VariableState state = current.variables.get(name);
            if (state != null) {
                return new Binding(state, crossedBoundary);
            }
            if (current.functionBoundary) {
                crossedBoundary = true;
            }
        }
        return null;
    }

    public VariableState getOwnVariable(String name) {
        return variables.get(name);
    }

    public Collection<VariableState> getOwnVariables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public FlowContext getParent() { return parent; }
    public boolean isFunctionBoundary() { return functionBoundary; }
    public boolean isInLoop() { return inLoop; }
    public boolean isInTry() { return inTry; }
    public String getLoopEntry() { return loopEntry; }
    public String getLoopExit() { return loopExit; }
    public String getSwitchExit() { return switchExit; }

    /** 最近的 {@code break} 目标：优先最内层 switch 出口，否则循环出口。 */
    public String getBreakTarget() {
        return switchExit != null ? switchExit : loopExit;
    }

    /**
     * {@link #resolve(String)} 的结果。
     *
     * @param captured 变量定义在当前函数之外
     */
    public record Binding(VariableState state, boolean captured) {
    }
}
