package org.refactor.semantics.scope;

import org.refactor.semantics.tree.NodeTypes;
import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * First pass of the semantic analysis: builds the scope tree and inserts every declaration
 * into the nearest enclosing scope.
 * <p>
 * Declaration-name nodes are recorded in {@code declarationNames} so that the reference pass
 * does not count them as uses.
 */
class DeclarationCollector {

    static final String ANONYMOUS = "<anonymous>";

    private static final Set<String> FUNCTION_DECLARATIONS = Set.of(
            "function_declaration", "FunctionDeclaration", "generator_function_declaration");
    private static final Set<String> CLOSURES = Set.of(
            "arrow_function", "ArrowFunctionExpression", "function", "function_expression",
            "FunctionExpression", "lambda_expression");
    private static final Set<String> METHODS = Set.of(
            "method_definition", "MethodDefinition", "method_declaration", "constructor_declaration");
    private static final Set<String> CLASSES = Set.of(
            "class_declaration", "ClassDeclaration", "class", "ClassExpression",
            "abstract_class_declaration", "record_declaration");
    private static final Set<String> CLASS_BODIES = Set.of("class_body", "ClassBody");
    private static final Set<String> FIELDS = Set.of(
            "public_field_definition", "field_definition", "PropertyDefinition", "field_declaration");
    private static final Set<String> IMPORTS = Set.of("import_statement", "ImportDeclaration");
    private static final Set<String> EXPORTS = Set.of(
            "export_statement", "ExportNamedDeclaration", "ExportDefaultDeclaration");
    private static final Set<String> INTERFACES = Set.of("interface_declaration", "TSInterfaceDeclaration");
    private static final Set<String> TYPE_ALIASES = Set.of("type_alias_declaration", "TSTypeAliasDeclaration");
    private static final Set<String> ENUMS = Set.of("enum_declaration", "TSEnumDeclaration");
    private static final Set<String> ENUM_MEMBERS = Set.of(
            "enum_assignment", "property_identifier", "enum_constant", "TSEnumMember");
    private static final Set<String> FOR_LOOPS = Set.of("for_statement", "ForStatement");
    private static final Set<String> FOR_EACH_LOOPS = Set.of(
            "for_in_statement", "ForInStatement", "for_of_statement", "ForOfStatement", "enhanced_for_statement");
    private static final Set<String> IFS = Set.of("if_statement", "IfStatement");
    private static final Set<String> SWITCHES = Set.of("switch_statement", "SwitchStatement");
    private static final Set<String> TRIES = Set.of("try_statement", "TryStatement", "try_with_resources_statement");

    private static final Set<String> OBJECT_PATTERNS = Set.of("object_pattern", "ObjectPattern");
    private static final Set<String> ARRAY_PATTERNS = Set.of("array_pattern", "ArrayPattern");
    private static final Set<String> REST_PATTERNS = Set.of("rest_pattern", "RestElement");
    private static final Set<String> DEFAULTED_PATTERNS = Set.of(
            "assignment_pattern", "AssignmentPattern", "object_assignment_pattern");
    private static final Set<String> SHORTHAND_PATTERNS = Set.of(
            "shorthand_property_identifier_pattern", "shorthand_property_identifier");
    private static final Set<String> PAIR_PATTERNS = Set.of("pair_pattern", "Property");
    private static final Set<String> TYPE_NAMES = Set.of("type_identifier", "identifier", "Identifier");

    private final ScopeTree tree;
    private final SemanticAnalysisOptions options;
    private final Set<SyntaxNode> declarationNames;

    DeclarationCollector(ScopeTree tree, SemanticAnalysisOptions options, Set<SyntaxNode> declarationNames) {
        this.tree = tree;
        this.options = options;
        this.declarationNames = declarationNames;
    }

    void collect(SyntaxNode node, String scopeId) {
        Scope scope = tree.get(scopeId);
        Integer maxScopeDepth = options.getMaxScopeDepth();
        if (scope != null && maxScopeDepth != null && scope.depth >= maxScopeDepth) {
            return;
        }

        String type = node.getType();
        if (FUNCTION_DECLARATIONS.contains(type)) {
            collectFunctionDeclaration(node, scopeId);
        } else if (CLOSURES.contains(type)) {
            collectClosure(node, scopeId);
        } else if (METHODS.contains(type)) {
            collectMethod(node, scopeId);
        } else if (CLASSES.contains(type)) {
            collectClass(node, scopeId);
        } else if (NodeTypes.VARIABLE_DECLARATIONS.contains(type)) {
            collectVariableDeclaration(node, scopeId);
        } else if (IMPORTS.contains(type)) {
            collectImport(node, scopeId);
        } else if (type.equals("import_declaration")) {
            collectJavaImport(node, scopeId);
        } else if (EXPORTS.contains(type)) {
            collectExport(node, scopeId);
        } else if (INTERFACES.contains(type)) {
            collectNamedType(node, SymbolKind.INTERFACE, scopeId);
        } else if (TYPE_ALIASES.contains(type)) {
            collectNamedType(node, SymbolKind.TYPE, scopeId);
        } else if (ENUMS.contains(type)) {
            collectEnum(node, scopeId);
        } else if (NodeTypes.BLOCKS.contains(type)) {
            Scope block = tree.create(ScopeKind.BLOCK, scopeId, SourceLocation.of(node), node);
            collectChildren(node, block.id);
        } else if (FOR_LOOPS.contains(type) || FOR_EACH_LOOPS.contains(type)) {
            collectLoop(node, scopeId);
        } else if (IFS.contains(type)) {
            collectIf(node, scopeId);
        } else if (SWITCHES.contains(type)) {
            collectSwitch(node, scopeId);
        } else if (TRIES.contains(type)) {
            collectTry(node, scopeId);
        } else if (NodeTypes.CATCH_CLAUSES.contains(type)) {
            collectCatch(node, scopeId);
        } else {
            collectChildren(node, scopeId);
        }
    }

    private void collectChildren(SyntaxNode node, String scopeId) {
        for (SyntaxNode child : node.getChildren()) {
            collect(child, scopeId);
        }
    }

    // ------------------------------------------------------------------
    // functions and classes
    // ------------------------------------------------------------------

    private void collectFunctionDeclaration(SyntaxNode node, String scopeId) {
        SyntaxNode nameNode = NodeTypes.nameOf(node, "identifier", "Identifier");
        SymbolInfo symbol = new SymbolInfo(nameOrAnonymous(nameNode), SymbolKind.FUNCTION, scopeId,
                SourceLocation.of(node));
        symbol.parameters = extractParameters(node);
        markDeclared(nameNode);
        tree.addSymbol(symbol);

        Scope functionScope = tree.create(ScopeKind.FUNCTION, scopeId, SourceLocation.of(node), node);
        declareParameters(node, symbol.parameters, functionScope.id);
        collectBody(node, functionScope.id);
    }

    private void collectClosure(SyntaxNode node, String scopeId) {
        Scope functionScope = tree.create(ScopeKind.FUNCTION, scopeId, SourceLocation.of(node), node);
        declareParameters(node, extractParameters(node), functionScope.id);
        collectBody(node, functionScope.id);
    }

    private void collectMethod(SyntaxNode node, String scopeId) {
        SyntaxNode nameNode = NodeTypes.nameOf(node, "property_identifier", "identifier", "Identifier");
        // estree methods keep params and body on a function-expression value
        SyntaxNode value = node.getChildForFieldName("value");
        SyntaxNode implementation = NodeTypes.isFunction(value) ? value : node;

        SymbolInfo symbol = new SymbolInfo(nameOrAnonymous(nameNode), SymbolKind.METHOD, scopeId,
                SourceLocation.of(node));
        symbol.visibility = visibilityOf(node);
        symbol.parameters = extractParameters(implementation);
        markDeclared(nameNode);
        tree.addSymbol(symbol);

        Scope methodScope = tree.create(ScopeKind.FUNCTION, scopeId, SourceLocation.of(node), node);
        if (implementation != node) {
            tree.alias(implementation, methodScope);
        }
        // implicit receiver; never reported as shadowing an enclosing method's receiver
        methodScope.symbols.put("this",
                new SymbolInfo("this", SymbolKind.VARIABLE, methodScope.id, SourceLocation.startOf(node)));
        declareParameters(implementation, symbol.parameters, methodScope.id);
        collectBody(implementation, methodScope.id);
    }

    private void collectBody(SyntaxNode function, String scopeId) {
        SyntaxNode body = NodeTypes.fieldOrChild(function, "body", NodeTypes.BLOCKS);
        if (body == null) {
            return;
        }
        if (NodeTypes.isBlock(body)) {
            collectChildren(body, scopeId);
        } else {
            // expression body
            collect(body, scopeId);
        }
    }

    private void collectClass(SyntaxNode node, String scopeId) {
        SyntaxNode nameNode = NodeTypes.nameOf(node, "type_identifier", "identifier", "Identifier");
        SymbolInfo symbol = new SymbolInfo(nameOrAnonymous(nameNode), SymbolKind.CLASS, scopeId,
                SourceLocation.of(node));
        symbol.visibility = visibilityOf(node);
        markDeclared(nameNode);
        tree.addSymbol(symbol);

        Scope classScope = tree.create(ScopeKind.CLASS, scopeId, SourceLocation.of(node), node);
        SyntaxNode body = NodeTypes.fieldOrChild(node, "body", CLASS_BODIES);
        if (body == null) {
            return;
        }
        for (SyntaxNode member : body.getChildren()) {
            if (METHODS.contains(member.getType())) {
                collectMethod(member, classScope.id);
            } else if (FIELDS.contains(member.getType())) {
                collectField(member, classScope.id);
            } else {
                collect(member, classScope.id);
            }
        }
    }

    private void collectField(SyntaxNode node, String scopeId) {
        Visibility visibility = visibilityOf(node);
        List<SyntaxNode> declarators = childrenOfType(node, NodeTypes.VARIABLE_DECLARATORS);

        if (declarators.isEmpty()) {
            SyntaxNode nameNode = NodeTypes.nameOf(node, "property_identifier", "private_property_identifier",
                    "identifier", "Identifier");
            if (nameNode == null) {
                return;
            }
            SymbolInfo symbol = new SymbolInfo(nameNode.getText(), SymbolKind.PROPERTY, scopeId, SourceLocation.of(node));
            symbol.visibility = visibility;
            markDeclared(nameNode);
            tree.addSymbol(symbol);
            SyntaxNode value = node.getChildForFieldName("value");
            if (value != null) {
                collect(value, scopeId);
            }
            return;
        }

        // java: one field declaration, several declarators
        for (SyntaxNode declarator : declarators) {
            SyntaxNode nameNode = declaratorTarget(declarator);
            if (!NodeTypes.isIdentifier(nameNode)) {
                continue;
            }
            SymbolInfo symbol = new SymbolInfo(nameNode.getText(), SymbolKind.PROPERTY, scopeId,
                    SourceLocation.of(nameNode));
            symbol.visibility = visibility;
            markDeclared(nameNode);
            tree.addSymbol(symbol);
            SyntaxNode initializer = NodeTypes.initializerOf(declarator);
            if (initializer != null) {
                collect(initializer, scopeId);
            }
        }
    }

    // ------------------------------------------------------------------
    // parameters
    // ------------------------------------------------------------------

    private List<ParameterInfo> extractParameters(SyntaxNode function) {
        List<ParameterInfo> parameters = new ArrayList<>();
        for (SyntaxNode param : parameterNodes(function)) {
            SyntaxNode name = parameterName(param);
            if (name == null) {
                continue;
            }
            parameters.add(new ParameterInfo(name.getText(), isOptional(param), isRest(param),
                    SourceLocation.of(name)));
            markDeclared(name);
        }
        return parameters;
    }

    private void declareParameters(SyntaxNode function, List<ParameterInfo> parameters, String scopeId) {
        for (ParameterInfo parameter : parameters) {
            tree.addSymbol(new SymbolInfo(parameter.name(), SymbolKind.PARAMETER, scopeId, parameter.location()));
        }
        // destructured parameters bind names but are not listed as parameters
        for (SyntaxNode param : parameterNodes(function)) {
            if (parameterName(param) != null) {
                continue;
            }
            SyntaxNode pattern = firstField(param, "pattern", "name");
            collectPattern(pattern != null ? pattern : param, scopeId, SymbolKind.PARAMETER);
        }
    }

    private static List<SyntaxNode> parameterNodes(SyntaxNode function) {
        List<SyntaxNode> nodes = new ArrayList<>();
        SyntaxNode single = function.getChildForFieldName("parameter");
        if (single != null) {
            nodes.add(single);
        }
        SyntaxNode params = NodeTypes.fieldOrChild(function, "parameters", NodeTypes.PARAMETER_LISTS);
        if (params == null) {
            params = function.getChildForFieldName("params");
        }
        if (params != null) {
            if (NodeTypes.isIdentifier(params)) {
                nodes.add(params);
            } else {
                nodes.addAll(params.getChildren());
            }
        }
        return nodes;
    }

    /** The identifier a parameter binds, or {@code null} for destructuring and unknown shapes. */
    private static SyntaxNode parameterName(SyntaxNode param) {
        if (NodeTypes.isIdentifier(param)) {
            return param;
        }
        String type = param.getType();
        if (!type.contains("parameter") && !REST_PATTERNS.contains(type) && !DEFAULTED_PATTERNS.contains(type)) {
            return null;
        }
        SyntaxNode name = firstField(param, "name", "pattern", "left");
        if (name == null) {
            name = NodeTypes.firstChildOfType(param, NodeTypes.IDENTIFIERS);
        }
        if (name != null && REST_PATTERNS.contains(name.getType())) {
            name = NodeTypes.firstChildOfType(name, NodeTypes.IDENTIFIERS);
        }
        return NodeTypes.isIdentifier(name) ? name : null;
    }

    private static boolean isOptional(SyntaxNode param) {
        return param.getType().equals("optional_parameter")
                || DEFAULTED_PATTERNS.contains(param.getType())
                || param.getChildForFieldName("value") != null;
    }

    private static boolean isRest(SyntaxNode param) {
        if (REST_PATTERNS.contains(param.getType()) || param.getType().equals("spread_parameter")) {
            return true;
        }
        SyntaxNode pattern = param.getChildForFieldName("pattern");
        return (pattern != null && REST_PATTERNS.contains(pattern.getType())) || param.getText().contains("...");
    }

    // ------------------------------------------------------------------
    // variables and patterns
    // ------------------------------------------------------------------

    private void collectVariableDeclaration(SyntaxNode node, String scopeId) {
        for (SyntaxNode child : node.getChildren()) {
            if (NodeTypes.VARIABLE_DECLARATORS.contains(child.getType())) {
                collectDeclarator(child, scopeId);
            }
        }
    }

    private void collectDeclarator(SyntaxNode declarator, String scopeId) {
        SyntaxNode target = declaratorTarget(declarator);
        if (target == null) {
            return;
        }
        collectPattern(target, scopeId, SymbolKind.VARIABLE);
        SyntaxNode initializer = NodeTypes.initializerOf(declarator);
        if (initializer != null) {
            collect(initializer, scopeId);
        }
    }

    /** Flattens identifiers, object/array patterns, rest elements and defaults into bindings. */
    private void collectPattern(SyntaxNode node, String scopeId, SymbolKind kind) {
        String type = node.getType();
        if (NodeTypes.isIdentifier(node) || SHORTHAND_PATTERNS.contains(type)) {
            markDeclared(node);
            tree.addSymbol(new SymbolInfo(node.getText(), kind, scopeId, SourceLocation.of(node)));
        } else if (OBJECT_PATTERNS.contains(type)) {
            for (SyntaxNode child : node.getChildren()) {
                if (PAIR_PATTERNS.contains(child.getType())) {
                    SyntaxNode value = child.getChildForFieldName("value");
                    if (value == null && !child.getChildren().isEmpty()) {
                        value = child.getChildren().get(child.getChildren().size() - 1);
                    }
                    if (value != null) {
                        collectPattern(value, scopeId, kind);
                    }
                } else {
                    collectPattern(child, scopeId, kind);
                }
            }
        } else if (ARRAY_PATTERNS.contains(type)) {
            for (SyntaxNode child : node.getChildren()) {
                collectPattern(child, scopeId, kind);
            }
        } else if (REST_PATTERNS.contains(type)) {
            for (SyntaxNode child : node.getChildren()) {
                collectPattern(child, scopeId, kind);
            }
        } else if (DEFAULTED_PATTERNS.contains(type)) {
            SyntaxNode left = node.getChildForFieldName("left");
            if (left == null && !node.getChildren().isEmpty()) {
                left = node.getChildren().get(0);
            }
            if (left != null) {
                collectPattern(left, scopeId, kind);
            }
        }
    }

    private static SyntaxNode declaratorTarget(SyntaxNode declarator) {
        SyntaxNode target = firstField(declarator, "name", "id");
        if (target != null) {
            return target;
        }
        return declarator.getChildren().isEmpty() ? null : declarator.getChildren().get(0);
    }

    // ------------------------------------------------------------------
    // modules
    // ------------------------------------------------------------------

    private void collectImport(SyntaxNode node, String scopeId) {
        SyntaxNode clause = NodeTypes.firstChildOfType(node, "import_clause");
        if (clause != null) {
            for (SyntaxNode child : clause.getChildren()) {
                if (NodeTypes.isIdentifier(child)) {
                    addImported(child, SymbolKind.VARIABLE, scopeId);
                } else if (child.getType().equals("named_imports")) {
                    for (SyntaxNode specifier : childrenOfType(child, Set.of("import_specifier"))) {
                        SyntaxNode local = firstField(specifier, "alias", "name");
                        if (local == null) {
                            local = lastChildOfType(specifier, NodeTypes.IDENTIFIERS);
                        }
                        if (NodeTypes.isIdentifier(local)) {
                            addImported(local, SymbolKind.VARIABLE, scopeId);
                        }
                    }
                } else if (child.getType().equals("namespace_import")) {
                    SyntaxNode name = NodeTypes.firstChildOfType(child, NodeTypes.IDENTIFIERS);
                    if (name != null) {
                        addImported(name, SymbolKind.NAMESPACE, scopeId);
                    }
                }
            }
        }

        for (SyntaxNode child : node.getChildren()) {
            String type = child.getType();
            if (type.equals("ImportSpecifier") || type.equals("ImportDefaultSpecifier")
                    || type.equals("ImportNamespaceSpecifier")) {
                SyntaxNode local = child.getChildForFieldName("local");
                if (local == null) {
                    local = lastChildOfType(child, NodeTypes.IDENTIFIERS);
                }
                if (local != null) {
                    addImported(local, type.equals("ImportNamespaceSpecifier") ? SymbolKind.NAMESPACE : SymbolKind.VARIABLE,
                            scopeId);
                }
            }
        }
    }

    /**
     * {@code import a.b.C;} binds {@code C}; {@code import static a.b.C.m;} binds {@code m}.
     * On-demand imports bind nothing.
     */
    private void collectJavaImport(SyntaxNode node, String scopeId) {
        String text = node.getText().trim();
        if (text.endsWith("*;") || text.endsWith("*") || NodeTypes.firstChildOfType(node, "asterisk") != null) {
            return;
        }
        SyntaxNode path = NodeTypes.firstChildOfType(node, Set.of("scoped_identifier", "identifier"));
        if (path == null) {
            return;
        }
        String qualified = path.getText().trim();
        String simpleName = qualified.substring(qualified.lastIndexOf('.') + 1);
        boolean isStatic = text.startsWith("import static");
        SymbolInfo symbol = new SymbolInfo(simpleName, isStatic ? SymbolKind.VARIABLE : SymbolKind.CLASS, scopeId,
                SourceLocation.of(path));
        symbol.imported = true;
        tree.addSymbol(symbol);
    }

    private void addImported(SyntaxNode nameNode, SymbolKind kind, String scopeId) {
        SymbolInfo symbol = new SymbolInfo(nameNode.getText(), kind, scopeId, SourceLocation.of(nameNode));
        symbol.imported = true;
        markDeclared(nameNode);
        tree.addSymbol(symbol);
    }

    /** Every symbol an export construct adds to the current scope is exported. */
    private void collectExport(SyntaxNode node, String scopeId) {
        Scope scope = tree.get(scopeId);
        if (scope == null) {
            return;
        }
        Set<SymbolInfo> before = Collections.newSetFromMap(new IdentityHashMap<>());
        before.addAll(scope.symbols.values());

        collectChildren(node, scopeId);

        for (SymbolInfo symbol : scope.symbols.values()) {
            if (!before.contains(symbol)) {
                symbol.exported = true;
            }
        }
    }

    // ------------------------------------------------------------------
    // types
    // ------------------------------------------------------------------

    private void collectNamedType(SyntaxNode node, SymbolKind kind, String scopeId) {
        SyntaxNode nameNode = NodeTypes.nameOf(node, "type_identifier", "identifier", "Identifier");
        if (nameNode == null) {
            return;
        }
        SymbolInfo symbol = new SymbolInfo(nameNode.getText(), kind, scopeId, SourceLocation.of(node));
        symbol.visibility = visibilityOf(node);
        markDeclared(nameNode);
        tree.addSymbol(symbol);
    }

    /** Enum members are added to the scope that declares the enum. */
    private void collectEnum(SyntaxNode node, String scopeId) {
        SyntaxNode nameNode = NodeTypes.nameOf(node, "identifier", "Identifier", "type_identifier");
        if (nameNode == null) {
            return;
        }
        SymbolInfo symbol = new SymbolInfo(nameNode.getText(), SymbolKind.ENUM, scopeId, SourceLocation.of(node));
        symbol.visibility = visibilityOf(node);
        markDeclared(nameNode);
        tree.addSymbol(symbol);

        SyntaxNode body = NodeTypes.fieldOrChild(node, "body", Set.of("enum_body"));
        if (body == null) {
            return;
        }
        for (SyntaxNode member : body.getChildren()) {
            if (!ENUM_MEMBERS.contains(member.getType())) {
                continue;
            }
            SyntaxNode memberName = member.getType().equals("property_identifier")
                    ? member
                    : firstField(member, "name", "id");
            if (memberName == null) {
                memberName = NodeTypes.firstChildOfType(member, Set.of("property_identifier", "identifier", "Identifier"));
            }
            if (memberName != null) {
                markDeclared(memberName);
                tree.addSymbol(new SymbolInfo(memberName.getText(), SymbolKind.ENUM_MEMBER, scopeId,
                        SourceLocation.of(memberName)));
            }
        }
    }

    // ------------------------------------------------------------------
    // control constructs
    // ------------------------------------------------------------------

    private void collectLoop(SyntaxNode node, String scopeId) {
        Scope loopScope = tree.create(ScopeKind.LOOP, scopeId, SourceLocation.of(node), node);

        SyntaxNode variable = null;
        if (FOR_EACH_LOOPS.contains(node.getType())) {
            SyntaxNode candidate = firstField(node, "left", "name");
            // `for (const x of xs)` and `for (T x : xs)` declare; `for (x of xs)` assigns
            boolean declares = node.getChildForFieldName("kind") != null || node.getChildForFieldName("type") != null;
            if (candidate != null && declares) {
                collectPattern(candidate, loopScope.id, SymbolKind.VARIABLE);
                variable = candidate;
            }
        }

        for (SyntaxNode child : node.getChildren()) {
            if (child == variable) {
                continue;
            }
            if (NodeTypes.VARIABLE_DECLARATIONS.contains(child.getType())) {
                collectVariableDeclaration(child, loopScope.id);
            } else if (NodeTypes.isBlock(child)) {
                collectChildren(child, loopScope.id);
            } else {
                collect(child, loopScope.id);
            }
        }
    }

    /** Each branch block gets its own conditional scope. */
    private void collectIf(SyntaxNode node, String scopeId) {
        for (SyntaxNode child : node.getChildren()) {
            if (NodeTypes.isBlock(child)) {
                collectBranch(child, scopeId);
            } else if (child.getType().equals("else_clause")) {
                for (SyntaxNode inner : child.getChildren()) {
                    if (NodeTypes.isBlock(inner)) {
                        collectBranch(inner, scopeId);
                    } else {
                        collect(inner, scopeId);
                    }
                }
            } else {
                collect(child, scopeId);
            }
        }
    }

    private void collectBranch(SyntaxNode block, String scopeId) {
        Scope branch = tree.create(ScopeKind.CONDITIONAL, scopeId, SourceLocation.of(block), block);
        collectChildren(block, branch.id);
    }

    private void collectSwitch(SyntaxNode node, String scopeId) {
        Scope switchScope = tree.create(ScopeKind.SWITCH, scopeId, SourceLocation.of(node), node);
        SyntaxNode body = NodeTypes.fieldOrChild(node, "body", NodeTypes.SWITCH_BODIES);
        collectChildren(body != null ? body : node, switchScope.id);
    }

    private void collectTry(SyntaxNode node, String scopeId) {
        SyntaxNode body = NodeTypes.fieldOrChild(node, "body", NodeTypes.BLOCKS);
        SyntaxNode resources = node.getChildForFieldName("resources");

        if (body != null) {
            Scope tryScope = tree.create(ScopeKind.BLOCK, scopeId, SourceLocation.of(body), body);
            if (resources != null) {
                collect(resources, tryScope.id);
            }
            collectChildren(body, tryScope.id);
        }

        for (SyntaxNode child : node.getChildren()) {
            if (child == body || child == resources) {
                continue;
            }
            if (NodeTypes.CATCH_CLAUSES.contains(child.getType())) {
                collectCatch(child, scopeId);
            } else if (NodeTypes.FINALLY_CLAUSES.contains(child.getType())) {
                SyntaxNode finallyBlock = NodeTypes.fieldOrChild(child, "body", NodeTypes.BLOCKS);
                if (finallyBlock != null) {
                    Scope finallyScope = tree.create(ScopeKind.BLOCK, scopeId, SourceLocation.of(finallyBlock),
                            finallyBlock);
                    collectChildren(finallyBlock, finallyScope.id);
                }
            } else {
                collect(child, scopeId);
            }
        }
    }

    private void collectCatch(SyntaxNode node, String scopeId) {
        Scope catchScope = tree.create(ScopeKind.CATCH, scopeId, SourceLocation.of(node), node);

        SyntaxNode param = firstField(node, "parameter", "param");
        if (param == null) {
            param = NodeTypes.firstChildOfType(node, "catch_formal_parameter");
        }
        if (param == null) {
            param = NodeTypes.firstChildOfType(node, NodeTypes.IDENTIFIERS);
        }
        if (param != null && param.getType().equals("catch_formal_parameter")) {
            param = NodeTypes.nameOf(param, "identifier");
        }
        if (param != null) {
            collectPattern(param, catchScope.id, SymbolKind.PARAMETER);
        }

        SyntaxNode body = NodeTypes.fieldOrChild(node, "body", NodeTypes.BLOCKS);
        if (body != null) {
            collectChildren(body, catchScope.id);
        }
    }

    // ------------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------------

    /**
     * Visibility from an {@code accessibility_modifier} or {@code modifiers} child, or a bare
     * keyword child.
     */
    static Visibility visibilityOf(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            String type = child.getType();
            String text = child.getText().trim();
            boolean modifierNode = type.equals("accessibility_modifier") || type.equals("modifiers");
            if (!modifierNode && !text.equals("public") && !text.equals("private") && !text.equals("protected")) {
                continue;
            }
            for (String token : text.split("\\s+")) {
                switch (token) {
                    case "public":
                        return Visibility.PUBLIC;
                    case "private":
                        return Visibility.PRIVATE;
                    case "protected":
                        return Visibility.PROTECTED;
                    default:
                        break;
                }
            }
        }
        return Visibility.DEFAULT;
    }

    private void markDeclared(SyntaxNode nameNode) {
        if (nameNode != null) {
            declarationNames.add(nameNode);
        }
    }

    private static String nameOrAnonymous(SyntaxNode nameNode) {
        return nameNode != null ? nameNode.getText() : ANONYMOUS;
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

    private static List<SyntaxNode> childrenOfType(SyntaxNode node, Set<String> types) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (types.contains(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    private static SyntaxNode lastChildOfType(SyntaxNode node, Set<String> types) {
        List<SyntaxNode> matches = childrenOfType(node, types);
        return matches.isEmpty() ? null : matches.get(matches.size() - 1);
    }
}
