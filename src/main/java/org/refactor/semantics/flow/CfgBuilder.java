package org.refactor.semantics.flow;

import org.refactor.semantics.tree.NodeTypes;
import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 构建一个程序或函数的控制流图 (CFG)。
 * 每个 {@code visit} 接收一组前驱节点 id，返回执行完当前结构后控制流可能停留的节点 id 集合；
 * 返回空集合表示控制流断开（return、throw、break、continue）。
 * <p>
 * 构建过程中顺便把变量声明收集到 {@link FlowContext} 中，之后连同声明名节点一起交给
 * {@link DataFlowCollector}。
 * <p>
 * 一个 builder 只能使用一次。
 */
public class CfgBuilder {

    private static final Logger log = LoggerFactory.getLogger(CfgBuilder.class);

    private static final Set<String> CONDITION_WRAPPERS = Set.of("parenthesized_expression", "condition");

    private static final Set<String> NO_VALUE_TYPES = Set.of("void", "undefined", "Promise<void>");

    private final FlowAnalysisOptions options;

    private final Map<String, CfgNode> nodes = new LinkedHashMap<>();
    private final List<CfgEdge> edges = new ArrayList<>();
    private final Set<String> edgeKeys = new HashSet<>();
    private final Set<String> exitIds = new LinkedHashSet<>();
    private String entryId;
    private int idCounter = 0;
    private int depth = 0;

    private final List<SourceLocation> infiniteLoops = new ArrayList<>();
    private final List<SourceLocation> missingReturns = new ArrayList<>();

    private FlowContext rootContext;
    private final List<FlowContext> contexts = new ArrayList<>();
    private final Map<SyntaxNode, FlowContext> contextsByNode = new IdentityHashMap<>();
    private final Set<SyntaxNode> bindings = Collections.newSetFromMap(new IdentityHashMap<>());

    public CfgBuilder(FlowAnalysisOptions options) {
        this.options = options;
    }

    /**
     * 构建整个程序（或任意块状根节点）的 CFG
     *
     * @return 执行到末尾、已连接到 EXIT 的节点 id
     */
    public Set<String> buildProgram(SyntaxNode root) {
        start(root);
        Set<String> last = visit(root, Set.of(entryId), rootContext);
        connect(last, exitId());
        return last;
    }

    /**
     * 构建单个函数的 CFG：参数先绑定到根上下文，再从 ENTRY 开始遍历函数体。
     * 只有块状函数体才做缺失 return 检查。
     */
    public Set<String> buildFunction(SyntaxNode function) {
        start(function);
        declareParameters(function, rootContext);
        markName(function);

        SyntaxNode body = functionBody(function);
        Set<String> last;
        if (body == null) {
            last = Set.of(entryId);
        } else if (NodeTypes.isBlock(body)) {
            last = visit(body, Set.of(entryId), rootContext);
        } else {
            // 表达式函数体
            collectDeclarations(body, rootContext);
            last = visit(body, Set.of(entryId), rootContext);
        }
        connect(last, exitId());

        if (body != null && NodeTypes.isBlock(body) && options.isDetectMissingReturns()) {
            checkMissingReturn(function, last);
        }
        return last;
    }

    private void start(SyntaxNode root) {
        if (entryId != null) {
            throw new IllegalStateException("CfgBuilder instances are single-use");
        }
        entryId = createNode(CfgNodeKind.ENTRY, SourceLocation.startOf(root), null).id;
        exitIds.add(createNode(CfgNodeKind.EXIT, SourceLocation.endOf(root), null).id);
        rootContext = FlowContext.root();
        contexts.add(rootContext);
    }

    private String exitId() {
        return exitIds.iterator().next();
    }

    // ------------------------------------------------------------------
    // 构建
    // ------------------------------------------------------------------

    Set<String> visit(SyntaxNode node, Set<String> predecessors, FlowContext ctx) {
        Integer maxDepth = options.getMaxDepth();
        if (maxDepth != null && depth > maxDepth) {
            return predecessors;
        }
        depth++;
        try {
            Construct construct = Construct.of(node.getType());
            return switch (construct) {
                case BLOCK -> visitBlock(node, predecessors, ctx);
                case IF -> visitIf(node, predecessors, ctx);
                case FOR, FOR_EACH, WHILE, DO_WHILE -> visitLoop(node, construct, predecessors, ctx);
                case SWITCH -> visitSwitch(node, predecessors, ctx);
                case TRY -> visitTry(node, predecessors, ctx);
                case RETURN -> visitTerminal(node, CfgNodeKind.RETURN, predecessors, ctx);
                case THROW -> visitTerminal(node, CfgNodeKind.THROW, predecessors, ctx);
                case BREAK -> handleBreak(node, predecessors, ctx);
                case CONTINUE -> handleContinue(node, predecessors, ctx);
                case LABELED -> visitLabeled(node, predecessors, ctx);
                case DECLARATION, STATEMENT -> visitStatement(node, predecessors, ctx);
                case OTHER -> NodeTypes.isStatement(node) ? visitStatement(node, predecessors, ctx) : predecessors;
            };
        } finally {
            depth--;
        }
    }

    private Set<String> visitBlock(SyntaxNode block, Set<String> predecessors, FlowContext ctx) {
        return visitSequence(block.getChildren(), predecessors, ctx);
    }

    /**
     * 按顺序连接语句。如果中间某句导致控制流全断（如 return），后续语句仍然建节点，
     * 但没有前驱，因此成为不可达代码。
     */
    private Set<String> visitSequence(List<SyntaxNode> statements, Set<String> predecessors, FlowContext ctx) {
        Set<String> current = predecessors;
        boolean cut = false;
        for (SyntaxNode statement : statements) {
            if (!isFlowStatement(statement)) {
                continue;
            }
            if (cut) {
                visit(statement, Set.of(), ctx);
                continue;
            }
            current = visit(statement, current, ctx);
            if (current.isEmpty()) {
                cut = true;
            }
        }
        return current;
    }

    private Set<String> visitIf(SyntaxNode node, Set<String> predecessors, FlowContext ctx) {
        CfgNode branch = createNode(CfgNodeKind.BRANCH, SourceLocation.startOf(node), node);
        connect(predecessors, branch.id);

        SyntaxNode condition = conditionOf(node);
        if (condition != null) {
            collectDeclarations(condition, ctx);
        }

        SyntaxNode consequence = consequenceOf(node);
        SyntaxNode alternative = alternativeOf(node);

        Set<String> exits = new LinkedHashSet<>();
        exits.addAll(consequence != null ? visit(consequence, Set.of(branch.id), ctx) : Set.of(branch.id));
        exits.addAll(alternative != null ? visit(alternative, Set.of(branch.id), ctx) : Set.of(branch.id));

        return mergeIfNeeded(node, exits);
    }

    private Set<String> visitLoop(SyntaxNode node, Construct construct, Set<String> predecessors, FlowContext ctx) {
        CfgNode head = createNode(CfgNodeKind.LOOP, SourceLocation.startOf(node), node);
        CfgNode exit = createNode(CfgNodeKind.MERGE, SourceLocation.endOf(node), null);

        FlowContext loopCtx = ctx.forLoop(head.id, exit.id);
        register(node, loopCtx);

        SyntaxNode body = loopBody(node);
        collectLoopHeader(node, body, construct, loopCtx);

        Set<String> bodyEntry;
        if (construct == Construct.DO_WHILE && body != null) {
            // do-while：第一次判断前先执行一次循环体
            bodyEntry = new LinkedHashSet<>(predecessors);
            bodyEntry.add(head.id);
        } else {
            connect(predecessors, head.id);
            bodyEntry = Set.of(head.id);
        }

        Set<String> bodyExits = body != null ? visit(body, bodyEntry, loopCtx) : Set.of(head.id);
        for (String bodyExit : bodyExits) {
            addEdge(bodyExit, head.id, null, true);
        }
        // 条件为假，跳出循环
        addEdge(head.id, exit.id, "exit", false);

        if ((construct == Construct.FOR || construct == Construct.WHILE) && options.isDetectInfiniteLoops()) {
            checkInfiniteLoop(node);
        }
        return Set.of(exit.id);
    }

    private Set<String> visitSwitch(SyntaxNode node, Set<String> predecessors, FlowContext ctx) {
        CfgNode branch = createNode(CfgNodeKind.BRANCH, SourceLocation.startOf(node), node);
        CfgNode exit = createNode(CfgNodeKind.MERGE, SourceLocation.endOf(node), null);
        connect(predecessors, branch.id);

        FlowContext switchCtx = ctx.forSwitch(exit.id);
        register(node, switchCtx);

        SyntaxNode selector = firstField(node, "condition", "value", "discriminant");
        if (selector != null) {
            collectDeclarations(selector, ctx);
        }

        SyntaxNode body = NodeTypes.fieldOrChild(node, "body", NodeTypes.SWITCH_BODIES);
        if (body == null) {
            // case 直接挂在 switch 节点下
            body = node;
        }

        Set<String> caseExits = new LinkedHashSet<>();
        Set<String> fallthrough = Set.of(branch.id);
        boolean hasDefault = false;

        for (SyntaxNode caseNode : body.getChildren()) {
            if (!NodeTypes.SWITCH_CASES.contains(caseNode.getType())) {
                continue;
            }
            hasDefault |= isDefaultCase(caseNode);
            boolean arrowCase = caseNode.getType().equals("switch_rule");

            Set<String> caseEntry = new LinkedHashSet<>();
            if (!arrowCase) {
                caseEntry.addAll(fallthrough);
            }
            caseEntry.add(branch.id);

            Set<String> caseOut = visitSequence(caseNode.getChildren(), caseEntry, switchCtx);
            if (arrowCase) {
                caseExits.addAll(caseOut);
                fallthrough = Set.of();
            } else {
                fallthrough = caseOut;
            }
        }
        caseExits.addAll(fallthrough);

        if (!hasDefault) {
            // 没有 case 命中
            addEdge(branch.id, exit.id, "default", false);
        }
        connect(caseExits, exit.id);
        return Set.of(exit.id);
    }

    /**
     * 每个 catch 与 try 块使用同一组前驱：try 块中任意语句都可能抛异常，
     * 这里不细化到语句粒度。
     */
    private Set<String> visitTry(SyntaxNode node, Set<String> predecessors, FlowContext ctx) {
        FlowContext tryCtx = ctx.forTry();
        SyntaxNode body = NodeTypes.fieldOrChild(node, "body", NodeTypes.BLOCKS);
        if (body == null) {
            body = node.getChildForFieldName("block");
        }
        SyntaxNode resources = node.getChildForFieldName("resources");
        if (resources != null) {
            register(resources, tryCtx);
            collectDeclarations(resources, tryCtx);
        }

        Set<String> exits = new LinkedHashSet<>();
        if (body != null) {
            register(body, tryCtx);
            exits.addAll(visit(body, predecessors, tryCtx));
        } else {
            exits.addAll(predecessors);
        }

        for (SyntaxNode catchClause : catchClauses(node)) {
            FlowContext catchCtx = ctx.forCatch();
            register(catchClause, catchCtx);
            declareCatchParameter(catchClause, catchCtx);
            SyntaxNode catchBody = NodeTypes.fieldOrChild(catchClause, "body", NodeTypes.BLOCKS);
            exits.addAll(catchBody != null ? visit(catchBody, predecessors, catchCtx) : predecessors);
        }

        SyntaxNode finallyClause = NodeTypes.firstChildOfType(node, NodeTypes.FINALLY_CLAUSES);
        if (finallyClause == null) {
            finallyClause = node.getChildForFieldName("finalizer");
        }
        if (finallyClause != null) {
            SyntaxNode finallyBody = NodeTypes.isBlock(finallyClause)
                    ? finallyClause
                    : NodeTypes.fieldOrChild(finallyClause, "body", NodeTypes.BLOCKS);
            if (finallyBody != null) {
                return visit(finallyBody, exits, ctx);
            }
        }
        return mergeIfNeeded(node, exits);
    }

    private Set<String> visitTerminal(SyntaxNode node, CfgNodeKind kind, Set<String> predecessors, FlowContext ctx) {
        CfgNode terminal = createNode(kind, SourceLocation.of(node), node);
        connect(predecessors, terminal.id);
        if (kind == CfgNodeKind.RETURN) {
            for (String exitId : exitIds) {
                addEdge(terminal.id, exitId, null, false);
            }
        }
        // 返回值或异常表达式里可能有闭包
        collectDeclarations(node, ctx);
        return Set.of();
    }

    /**
     * 不解析标签：带标签的 {@code break} 与普通 break 一样跳到最内层 switch 或循环。
     */
    private Set<String> handleBreak(SyntaxNode node, Set<String> predecessors, FlowContext ctx) {
        CfgNode breakNode = createNode(CfgNodeKind.BREAK, SourceLocation.of(node), node);
        connect(predecessors, breakNode.id);
        String target = ctx.getBreakTarget();
        if (target != null) {
            addEdge(breakNode.id, target, null, false);
        } else {
            log.debug("break at {} has no enclosing loop or switch", node.getStartPosition());
        }
        return Set.of();
    }

    private Set<String> handleContinue(SyntaxNode node, Set<String> predecessors, FlowContext ctx) {
        CfgNode continueNode = createNode(CfgNodeKind.CONTINUE, SourceLocation.of(node), node);
        connect(predecessors, continueNode.id);
        if (ctx.getLoopEntry() != null) {
            addEdge(continueNode.id, ctx.getLoopEntry(), null, true);
        }
        return Set.of();
    }

    private Set<String> visitLabeled(SyntaxNode node, Set<String> predecessors, FlowContext ctx) {
        SyntaxNode body = node.getChildForFieldName("body");
        if (body == null) {
            List<SyntaxNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0 && body == null; i--) {
                if (isFlowStatement(children.get(i))) {
                    body = children.get(i);
                }
            }
        }
        return body != null ? visit(body, predecessors, ctx) : predecessors;
    }

    private Set<String> visitStatement(SyntaxNode node, Set<String> predecessors, FlowContext ctx) {
        CfgNode statement = createNode(CfgNodeKind.STATEMENT, SourceLocation.of(node), node);
        connect(predecessors, statement.id);
        collectDeclarations(node, ctx);
        return Set.of(statement.id);
    }

    private Set<String> mergeIfNeeded(SyntaxNode node, Set<String> exits) {
        if (exits.size() <= 1) {
            return exits;
        }
        CfgNode merge = createNode(CfgNodeKind.MERGE, SourceLocation.endOf(node), null);
        connect(exits, merge.id);
        return Set.of(merge.id);
    }

    // ------------------------------------------------------------------
    // 变量声明
    // ------------------------------------------------------------------

    /**
     * 把 {@code node} 下声明的变量绑定到 {@code ctx}。
     * 嵌套函数使用独立的函数边界上下文，并登记给数据流分析使用。
     */
    private void collectDeclarations(SyntaxNode node, FlowContext ctx) {
        if (NodeTypes.isFunction(node)) {
            FlowContext functionCtx = ctx.forFunction();
            register(node, functionCtx);
            declareParameters(node, functionCtx);
            markName(node);
            for (SyntaxNode child : node.getChildren()) {
                collectDeclarations(child, functionCtx);
            }
            return;
        }

        if (NodeTypes.CATCH_CLAUSES.contains(node.getType())) {
            declareCatchParameter(node, ctx);
        } else if (Construct.of(node.getType()) == Construct.FOR_EACH) {
            SyntaxNode variable = iterationVariable(node);
            declareIterationVariable(variable, ctx);
            for (SyntaxNode child : node.getChildren()) {
                if (child != variable) {
                    collectDeclarations(child, ctx);
                }
            }
            return;
        } else if (NodeTypes.VARIABLE_DECLARATORS.contains(node.getType())) {
            SyntaxNode name = declaratorName(node);
            if (NodeTypes.isIdentifier(name)) {
                SourceLocation location = SourceLocation.of(name);
                ctx.declare(NodeTypes.initializerOf(node) != null
                        ? VariableState.initializedAt(name.getText(), location)
                        : new VariableState(name.getText(), location));
                bindings.add(name);
            }
        }

        for (SyntaxNode child : node.getChildren()) {
            collectDeclarations(child, ctx);
        }
    }

    private void collectLoopHeader(SyntaxNode loop, SyntaxNode body, Construct construct, FlowContext loopCtx) {
        SyntaxNode variable = null;
        if (construct == Construct.FOR_EACH) {
            variable = iterationVariable(loop);
            declareIterationVariable(variable, loopCtx);
        }
        for (SyntaxNode child : loop.getChildren()) {
            if (child != body && child != variable) {
                collectDeclarations(child, loopCtx);
            }
        }
    }

    private void declareParameters(SyntaxNode function, FlowContext ctx) {
        SyntaxNode single = function.getChildForFieldName("parameter");
        if (NodeTypes.isIdentifier(single)) {
            declareBound(single, ctx);
        }

        SyntaxNode params = NodeTypes.fieldOrChild(function, "parameters", NodeTypes.PARAMETER_LISTS);
        if (params == null) {
            params = function.getChildForFieldName("params");
        }
        if (params == null) {
            return;
        }
        if (NodeTypes.isIdentifier(params)) {
            declareBound(params, ctx);
            return;
        }
        for (SyntaxNode param : params.getChildren()) {
            SyntaxNode name = parameterName(param);
            if (name != null) {
                declareBound(name, ctx);
            }
        }
    }

    private static SyntaxNode parameterName(SyntaxNode param) {
        if (NodeTypes.isIdentifier(param)) {
            return param;
        }
        SyntaxNode name = firstField(param, "name", "pattern");
        if (NodeTypes.isIdentifier(name)) {
            return name;
        }
        if (param.getType().contains("parameter")) {
            return NodeTypes.firstChildOfType(param, NodeTypes.IDENTIFIERS);
        }
        // 解构模式不绑定
        return null;
    }

    private void declareCatchParameter(SyntaxNode catchClause, FlowContext ctx) {
        SyntaxNode param = firstField(catchClause, "parameter", "param");
        if (param == null) {
            param = NodeTypes.firstChildOfType(catchClause, "catch_formal_parameter");
        }
        if (param == null) {
            param = NodeTypes.firstChildOfType(catchClause, NodeTypes.IDENTIFIERS);
        }
        if (param != null && !NodeTypes.isIdentifier(param)) {
            param = NodeTypes.nameOf(param, "identifier", "Identifier");
        }
        if (NodeTypes.isIdentifier(param)) {
            declareBound(param, ctx);
        }
    }

    private static SyntaxNode iterationVariable(SyntaxNode loop) {
        return firstField(loop, "left", "name");
    }

    /** 循环变量每次迭代都会被赋值，不论是否带声明。 */
    private void declareIterationVariable(SyntaxNode variable, FlowContext ctx) {
        if (variable == null) {
            return;
        }
        if (NodeTypes.isIdentifier(variable)) {
            declareBound(variable, ctx);
            return;
        }
        forEachDeclaratorName(variable, name -> declareBound(name, ctx));
    }

    private static void forEachDeclaratorName(SyntaxNode node, Consumer<SyntaxNode> action) {
        if (NodeTypes.VARIABLE_DECLARATORS.contains(node.getType())) {
            SyntaxNode name = declaratorName(node);
            if (NodeTypes.isIdentifier(name)) {
                action.accept(name);
            }
        }
        for (SyntaxNode child : node.getChildren()) {
            forEachDeclaratorName(child, action);
        }
    }

    private void declareBound(SyntaxNode name, FlowContext ctx) {
        ctx.declare(VariableState.bound(name.getText(), SourceLocation.of(name)));
        bindings.add(name);
    }

    private void markName(SyntaxNode function) {
        SyntaxNode name = function.getChildForFieldName("name");
        if (NodeTypes.isIdentifier(name)) {
            bindings.add(name);
        }
    }

    private static SyntaxNode declaratorName(SyntaxNode declarator) {
        SyntaxNode name = firstField(declarator, "name", "id");
        if (name != null) {
            return name;
        }
        return declarator.getChildren().isEmpty() ? null : declarator.getChildren().get(0);
    }

    // ------------------------------------------------------------------
    // 启发式检查
    // ------------------------------------------------------------------

    private void checkInfiniteLoop(SyntaxNode loop) {
        SyntaxNode condition = conditionOf(loop);
        if (condition == null) {
            return;
        }
        String text = conditionText(condition);
        if ((text.equals("true") || text.equals("1")) && !containsBreakOrReturn(loop)) {
            infiniteLoops.add(SourceLocation.of(loop));
        }
    }

    private static String conditionText(SyntaxNode condition) {
        SyntaxNode current = condition;
        while (CONDITION_WRAPPERS.contains(current.getType()) && !current.getChildren().isEmpty()) {
            current = current.getChildren().get(0);
        }
        String text = current.getText().trim();
        while (text.length() >= 2 && text.startsWith("(") && text.endsWith(")")) {
            text = text.substring(1, text.length() - 1).trim();
        }
        return text;
    }

    private static boolean containsBreakOrReturn(SyntaxNode node) {
        Construct construct = Construct.of(node.getType());
        if (construct == Construct.BREAK || construct == Construct.RETURN) {
            return true;
        }
        for (SyntaxNode child : node.getChildren()) {
            if (containsBreakOrReturn(child)) {
                return true;
            }
        }
        return false;
    }

    private void checkMissingReturn(SyntaxNode function, Set<String> lastNodes) {
        SyntaxNode returnType = returnTypeOf(function);
        if (returnType == null) {
            return;
        }
        if (NO_VALUE_TYPES.contains(typeName(returnType))) {
            return;
        }
        for (String id : lastNodes) {
            CfgNode node = nodes.get(id);
            if (node != null && node.kind != CfgNodeKind.RETURN && node.kind != CfgNodeKind.THROW) {
                missingReturns.add(SourceLocation.of(function));
                return;
            }
        }
    }

    /** 去掉冒号和空白后的返回类型文本，例如 {@code Promise<void>}。 */
    private static String typeName(SyntaxNode returnType) {
        String text = returnType.getText().trim();
        if (text.startsWith(":")) {
            text = text.substring(1);
        }
        return text.replaceAll("\\s+", "");
    }

    private static SyntaxNode returnTypeOf(SyntaxNode function) {
        SyntaxNode returnType = function.getChildForFieldName("return_type");
        if (returnType == null) {
            returnType = NodeTypes.firstChildOfType(function, Set.of("type_annotation", "return_type"));
        }
        if (returnType == null) {
            // Java 方法
            returnType = function.getChildForFieldName("type");
        }
        return returnType;
    }

    /** 从 ENTRY 广度优先遍历，标记 {@link CfgNode#reachable}。 */
    public void markReachable() {
        Set<String> visited = new HashSet<>();
        ArrayDeque<String> queue = new ArrayDeque<>();
        queue.add(entryId);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!visited.add(id)) {
                continue;
            }
            CfgNode node = nodes.get(id);
            if (node == null) {
                continue;
            }
            node.reachable = true;
            for (String next : node.outgoing) {
                if (!visited.contains(next)) {
                    queue.add(next);
                }
            }
        }
    }

    /** {@link #markReachable()} 没有到达的非辅助节点位置。 */
    public List<SourceLocation> unreachableCode() {
        List<SourceLocation> result = new ArrayList<>();
        for (CfgNode node : nodes.values()) {
            if (!node.reachable && !node.kind.isScaffolding() && node.syntaxNode != null) {
                result.add(node.location);
            }
        }
        return result;
    }

    public ControlFlowGraph toGraph() {
        CfgNode entry = entryId != null ? nodes.get(entryId) : null;
        if (entry == null) {
            throw new FlowAnalysisException("Entry node not found");
        }
        List<CfgNode> exits = new ArrayList<>();
        for (String id : exitIds) {
            exits.add(nodes.get(id));
        }
        return new ControlFlowGraph(entry, exits, new ArrayList<>(nodes.values()), edges);
    }

    // ------------------------------------------------------------------
    // 图操作
    // ------------------------------------------------------------------

    private CfgNode createNode(CfgNodeKind kind, SourceLocation location, SyntaxNode syntaxNode) {
        CfgNode node = new CfgNode("cfg_" + idCounter++, kind, location, syntaxNode);
        nodes.put(node.id, node);
        return node;
    }

    private void addEdge(String from, String to, String label, boolean backEdge) {
        CfgNode source = nodes.get(from);
        CfgNode target = nodes.get(to);
        if (source == null || target == null) return;
        if (!edgeKeys.add(from + "->" + to)) return;
        source.outgoing.add(to);
        target.incoming.add(from);
        edges.add(new CfgEdge(from, to, label, backEdge));
    }

    private void connect(Set<String> predecessors, String to) {
        for (String from : predecessors) {
            addEdge(from, to, null, false);
        }
    }

    private void register(SyntaxNode node, FlowContext ctx) {
        contextsByNode.put(node, ctx);
        contexts.add(ctx);
    }

    // ------------------------------------------------------------------
    // 子节点查找
    // ------------------------------------------------------------------

    private static boolean isFlowStatement(SyntaxNode node) {
        return NodeTypes.isStatement(node) || NodeTypes.isBlock(node);
    }

    private static SyntaxNode firstField(SyntaxNode node, String... fields) {
        for (String field : fields) {
            SyntaxNode child = node.getChildForFieldName(field);
            if (child != null) {
                return child;
            }
        }
        return null;
    }

    static SyntaxNode conditionOf(SyntaxNode node) {
        SyntaxNode condition = firstField(node, "condition", "test");
        return condition != null ? condition : NodeTypes.firstChildOfType(node, CONDITION_WRAPPERS);
    }

    private static SyntaxNode consequenceOf(SyntaxNode ifNode) {
        SyntaxNode consequence = firstField(ifNode, "consequence", "consequent");
        if (consequence != null) {
            return consequence;
        }
        consequence = NodeTypes.firstChildOfType(ifNode, NodeTypes.BLOCKS);
        if (consequence != null) {
            return consequence;
        }
        for (SyntaxNode child : ifNode.getChildren()) {
            if (isFlowStatement(child) && !child.getType().equals("else_clause")) {
                return child;
            }
        }
        return null;
    }

    private static SyntaxNode alternativeOf(SyntaxNode ifNode) {
        SyntaxNode alternative = firstField(ifNode, "alternative", "alternate");
        if (alternative == null) {
            alternative = NodeTypes.firstChildOfType(ifNode, "else_clause");
        }
        if (alternative != null && alternative.getType().equals("else_clause")) {
            for (SyntaxNode child : alternative.getChildren()) {
                if (isFlowStatement(child)) {
                    return child;
                }
            }
            return null;
        }
        return alternative;
    }

    private static SyntaxNode loopBody(SyntaxNode loop) {
        SyntaxNode body = NodeTypes.fieldOrChild(loop, "body", NodeTypes.BLOCKS);
        if (body != null) {
            return body;
        }
        for (SyntaxNode child : loop.getChildren()) {
            if (NodeTypes.isStatement(child)) {
                return child;
            }
        }
        return null;
    }

    private static SyntaxNode functionBody(SyntaxNode function) {
        return NodeTypes.fieldOrChild(function, "body", NodeTypes.BLOCKS);
    }

    private static List<SyntaxNode> catchClauses(SyntaxNode tryNode) {
        List<SyntaxNode> clauses = new ArrayList<>();
        for (SyntaxNode child : tryNode.getChildren()) {
            if (NodeTypes.CATCH_CLAUSES.contains(child.getType())) {
                clauses.add(child);
            }
        }
        SyntaxNode handler = tryNode.getChildForFieldName("handler");
        if (handler != null && !clauses.contains(handler)) {
            clauses.add(handler);
        }
        return clauses;
    }

    private static boolean isDefaultCase(SyntaxNode caseNode) {
        String type = caseNode.getType();
        if (type.equals("switch_default") || type.equals("default")) {
            return true;
        }
        if (caseNode.getText().trim().startsWith("default")) {
            return true;
        }
        SyntaxNode label = NodeTypes.firstChildOfType(caseNode, "switch_label");
        return label != null && label.getText().trim().startsWith("default");
    }

    // ------------------------------------------------------------------
    // 结果
    // ------------------------------------------------------------------

    public FlowContext getRootContext() { return rootContext; }
    public List<FlowContext> getContexts() { return Collections.unmodifiableList(contexts); }
    public Map<SyntaxNode, FlowContext> getContextsByNode() { return Collections.unmodifiableMap(contextsByNode); }
    public Set<SyntaxNode> getBindings() { return Collections.unmodifiableSet(bindings); }
    public List<SourceLocation> getInfiniteLoops() { return infiniteLoops; }
    public List<SourceLocation> getMissingReturns() { return missingReturns; }
}
