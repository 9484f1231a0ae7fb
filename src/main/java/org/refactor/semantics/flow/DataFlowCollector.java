package org.refactor.semantics.flow;

import org.refactor.semantics.tree.NodeTypes;
import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 借助构建 CFG 时填好的 {@link FlowContext}，把每个标识符的出现归为读、写或闭包捕获。
 * <p>
 * 只有两种写：简单赋值左侧的标识符，以及自增/自减的操作数（同时也算读）。
 * 复合赋值和解构赋值的目标按默认规则算作读。
 */
public class DataFlowCollector {

    private static final List<String> MEMBER_NAME_FIELDS = List.of("property", "field", "name");

    private final FlowAnalysisOptions options;
    private final Map<SyntaxNode, FlowContext> contextsByNode;
    private final Set<SyntaxNode> bindings;
    private final DataFlowInfo info = new DataFlowInfo();

    /**
     * @param contextsByNode CFG 构建时记录的上下文切换点
     * @param bindings       声明名节点，永远不算读
     */
    public DataFlowCollector(FlowAnalysisOptions options, Map<SyntaxNode, FlowContext> contextsByNode,
                             Set<SyntaxNode> bindings) {
        this.options = options;
        this.contextsByNode = contextsByNode;
        this.bindings = bindings;
    }

    public DataFlowInfo collect(SyntaxNode root, FlowContext rootContext, List<FlowContext> contexts) {
        traverse(root, rootContext);

        if (options.isDetectUnusedVariables()) {
            for (FlowContext ctx : contexts) {
                for (VariableState state : ctx.getOwnVariables()) {
                    if (state.isUnused()) {
                        info.unusedVariables.add(state.name);
                    }
                }
            }
        }
        if (options.isDetectNullDereferences()) {
            detectNullDereferences(root);
        }
        return info;
    }

    private void traverse(SyntaxNode node, FlowContext ctx) {
        FlowContext scoped = contextsByNode.get(node);
        if (scoped != null) {
            ctx = scoped;
        }
        String type = node.getType();

        if (NodeTypes.isIdentifier(node)) {
            if (!bindings.contains(node)) {
                recordRead(node, ctx);
            }
            return;
        }

        if (NodeTypes.ASSIGNMENTS.contains(type) && !isCompoundAssignment(node)) {
            SyntaxNode target = assignmentTarget(node);
            // 先访问右侧：右侧的读看到的是赋值前的状态
            for (SyntaxNode child : node.getChildren()) {
                if (child != target) {
                    traverse(child, ctx);
                }
            }
            if (NodeTypes.isIdentifier(target)) {
                recordWrite(target, ctx);
            } else if (target != null) {
                traverse(target, ctx);
            }
            return;
        }

        if (NodeTypes.UPDATES.contains(type)) {
            SyntaxNode operand = node.getChildForFieldName("argument");
            if (operand == null) {
                operand = NodeTypes.firstChildOfType(node, NodeTypes.IDENTIFIERS);
            }
            if (NodeTypes.isIdentifier(operand)) {
                recordRead(operand, ctx);
                recordWrite(operand, ctx);
                for (SyntaxNode child : node.getChildren()) {
                    if (child != operand) {
                        traverse(child, ctx);
                    }
                }
                return;
            }
        }

        if (NodeTypes.VARIABLE_DECLARATORS.contains(type)) {
            for (SyntaxNode child : node.getChildren()) {
                traverse(child, ctx);
            }
            SyntaxNode name = firstBinding(node);
            if (name != null && NodeTypes.initializerOf(node) != null) {
                info.writes.add(new DataFlowVariable(name.getText(), SourceLocation.of(name)));
            }
            return;
        }

        if (NodeTypes.MEMBER_ACCESSES.contains(type) || NodeTypes.CALLS.contains(type)) {
            // obj.prop、obj.method()：成员名不是变量
            for (SyntaxNode child : node.getChildren()) {
                if (NodeTypes.isIdentifier(child) && isMemberName(node, child)) {
                    continue;
                }
                traverse(child, ctx);
            }
            return;
        }

        for (SyntaxNode child : node.getChildren()) {
            traverse(child, ctx);
        }
    }

    private void recordRead(SyntaxNode identifier, FlowContext ctx) {
        FlowContext.Binding binding = ctx.resolve(identifier.getText());
        if (binding == null) {
            return;
        }
        VariableState state = binding.state();
        SourceLocation location = SourceLocation.of(identifier);
        DataFlowVariable access = new DataFlowVariable(state.name, location);

        if (binding.captured()) {
            state.captured = true;
            info.captures.add(access);
            return;
        }
        state.read = true;
        state.readLocations.add(location);
        info.reads.add(access);
        if (!state.initialized && options.isDetectUninitializedReads()) {
            info.uninitializedReads.add(access);
        }
    }

    private void recordWrite(SyntaxNode identifier, FlowContext ctx) {
        FlowContext.Binding binding = ctx.resolve(identifier.getText());
        if (binding == null) {
            return;
        }
        VariableState state = binding.state();
        SourceLocation location = SourceLocation.of(identifier);
        DataFlowVariable access = new DataFlowVariable(state.name, location);

        state.written = true;
        state.initialized = true;
        state.writeLocations.add(location);
        info.writes.add(access);
        if (binding.captured()) {
            state.captured = true;
            info.captures.add(access);
        }
    }

    private static boolean isMemberName(SyntaxNode access, SyntaxNode child) {
        for (String field : MEMBER_NAME_FIELDS) {
            if (access.getChildForFieldName(field) == child) {
                return true;
            }
        }
        return false;
    }

    private SyntaxNode firstBinding(SyntaxNode declarator) {
        for (SyntaxNode child : declarator.getChildren()) {
            if (bindings.contains(child)) {
                return child;
            }
        }
        return null;
    }

    private static SyntaxNode assignmentTarget(SyntaxNode assignment) {
        SyntaxNode left = assignment.getChildForFieldName("left");
        if (left != null) {
            return left;
        }
        return assignment.getChildren().isEmpty() ? null : assignment.getChildren().get(0);
    }

    private static boolean isCompoundAssignment(SyntaxNode assignment) {
        SyntaxNode operator = assignment.getChildForFieldName("operator");
        return operator != null && !operator.getText().trim().equals("=");
    }

    // ------------------------------------------------------------------
    // 空值解引用
    // ------------------------------------------------------------------

    private void detectNullDereferences(SyntaxNode node) {
        String type = node.getType();
        SyntaxNode receiver = null;
        if (NodeTypes.MEMBER_ACCESSES.contains(type)) {
            receiver = firstFieldOrFirstChild(node, "object");
        } else if (NodeTypes.CALLS.contains(type)) {
            receiver = firstFieldOrFirstChild(node, "function", "callee", "object");
        }
        if (receiver != null && isPotentiallyNull(receiver)) {
            info.nullDereferences.add(SourceLocation.of(node));
        }
        for (SyntaxNode child : node.getChildren()) {
            detectNullDereferences(child);
        }
    }

    /**
     * 仅按语法判断：null/undefined 字面量、可选链结果，以及某个分支为 null/undefined 的条件表达式。
     */
    private static boolean isPotentiallyNull(SyntaxNode node) {
        String type = node.getType();
        String text = node.getText();
        if (NodeTypes.NULL_LITERALS.contains(type) || text.equals("null") || text.equals("undefined")) {
            return true;
        }
        if (NodeTypes.OPTIONAL_CHAINS.contains(type)) {
            return true;
        }
        if (type.equals("parenthesized_expression") && !node.getChildren().isEmpty()) {
            SyntaxNode inner = node.getChildren().get(0);
            return isPotentiallyNull(inner) || hasOptionalChain(inner);
        }
        if (NodeTypes.CONDITIONALS.contains(type)) {
            SyntaxNode consequence = branch(node, 1, "consequence", "consequent");
            SyntaxNode alternative = branch(node, 2, "alternative", "alternate");
            return (consequence != null && isPotentiallyNull(consequence))
                    || (alternative != null && isPotentiallyNull(alternative));
        }
        return false;
    }

    private static boolean hasOptionalChain(SyntaxNode node) {
        return NodeTypes.firstChildOfType(node, NodeTypes.OPTIONAL_CHAINS) != null;
    }

    private static SyntaxNode branch(SyntaxNode conditional, int index, String... fields) {
        for (String field : fields) {
            SyntaxNode child = conditional.getChildForFieldName(field);
            if (child != null) {
                return child;
            }
        }
        List<SyntaxNode> children = conditional.getChildren();
        return children.size() > index ? children.get(index) : null;
    }

    private static SyntaxNode firstFieldOrFirstChild(SyntaxNode node, String... fields) {
        for (String field : fields) {
            SyntaxNode child = node.getChildForFieldName(field);
            if (child != null) {
                return child;
            }
        }
        return node.getChildren().isEmpty() ? null : node.getChildren().get(0);
    }
}
