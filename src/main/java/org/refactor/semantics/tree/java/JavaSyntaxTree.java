package org.refactor.semantics.tree.java;

import com.github.javaparser.ast.ArrayCreationLevel;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.UnionType;
import com.github.javaparser.ast.type.UnknownType;
import com.github.javaparser.ast.type.VoidType;
import org.refactor.semantics.tree.Position;
import org.refactor.semantics.tree.SimpleSyntaxNode;
import org.refactor.semantics.tree.SyntaxNode;

/**
 * Converts a JavaParser AST into {@link SyntaxNode}s named after the tree-sitter Java grammar,
 * so the analyzers see Java the same way they see trees from an external tree-sitter parser.
 * <p>
 * Node types and field names follow tree-sitter-java ({@code if_statement} with
 * {@code condition}/{@code consequence}/{@code alternative}, {@code method_invocation} with
 * {@code object}/{@code name}/{@code arguments}, ...), with two departures: switch statements
 * are {@code switch_statement}, and try-with-resources declares its resources as
 * {@code local_variable_declaration}s. Positions are 0-based with exclusive ends; text is
 * sliced from the source. Comments and annotations are dropped.
 */
public final class JavaSyntaxTree {

    private final SourceText source;

    private JavaSyntaxTree(String source) {
        this.source = new SourceText(source);
    }

    /** The whole file as a {@code program} node spanning all of {@code source}. */
    public static SyntaxNode from(CompilationUnit unit, String source) {
        return new JavaSyntaxTree(source).compilationUnit(unit);
    }

    /** A single declaration, statement or expression of a file parsed from {@code source}. */
    public static SyntaxNode from(Node node, String source) {
        return new JavaSyntaxTree(source).convert(node);
    }

    private SyntaxNode compilationUnit(CompilationUnit unit) {
        SimpleSyntaxNode.Builder program = node("program", Position.ORIGIN, source.endOfText());
        unit.getPackageDeclaration().ifPresent(p -> program.child(packageDeclaration(p)));
        for (ImportDeclaration importDeclaration : unit.getImports()) {
            program.child(node("import_declaration", importDeclaration).child(name(importDeclaration.getName())).build());
        }
        for (TypeDeclaration<?> type : unit.getTypes()) {
            program.child(typeDeclaration(type));
        }
        return program.build();
    }

    private SyntaxNode packageDeclaration(PackageDeclaration declaration) {
        return node("package_declaration", declaration).child(name(declaration.getName())).build();
    }

    private SyntaxNode convert(Node node) {
        if (node instanceof CompilationUnit unit) {
            return compilationUnit(unit);
        }
        if (node instanceof Statement statement) {
            return statement(statement);
        }
        if (node instanceof Expression expression) {
            return expression(expression);
        }
        if (node instanceof BodyDeclaration<?> member) {
            return member(member);
        }
        if (node instanceof Type type) {
            return type(type);
        }
        if (node instanceof SimpleName simpleName) {
            return identifier(simpleName);
        }
        if (node instanceof Name qualified) {
            return name(qualified);
        }
        if (node instanceof Parameter parameter) {
            return parameter(parameter);
        }
        if (node instanceof VariableDeclarator declarator) {
            return declarator(declarator);
        }
        return generic(node);
    }

    // ------------------------------------------------------------------
    // declarations
    // ------------------------------------------------------------------

    private SyntaxNode typeDeclaration(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration declaration) {
            return classOrInterface(declaration);
        }
        if (type instanceof EnumDeclaration declaration) {
            return enumDeclaration(declaration);
        }
        if (type instanceof RecordDeclaration declaration) {
            return recordDeclaration(declaration);
        }
        SimpleSyntaxNode.Builder b = node("annotation_type_declaration", type);
        modifiers(b, type.getModifiers());
        return b.child("name", identifier(type.getName())).build();
    }

    private SyntaxNode classOrInterface(ClassOrInterfaceDeclaration declaration) {
        boolean isInterface = declaration.isInterface();
        SimpleSyntaxNode.Builder b = node(isInterface ? "interface_declaration" : "class_declaration", declaration);
        modifiers(b, declaration.getModifiers());
        b.child("name", identifier(declaration.getName()));
        if (!declaration.getExtendedTypes().isEmpty()) {
            b.child(isInterface ? "extends_interfaces" : "superclass",
                    typeList(isInterface ? "extends_interfaces" : "superclass", declaration.getExtendedTypes()));
        }
        if (!declaration.getImplementedTypes().isEmpty()) {
            b.child("interfaces", typeList("super_interfaces", declaration.getImplementedTypes()));
        }
        Position bodyStart = braceAfter(declaration.getName(), declaration);
        b.child("body", classBody(isInterface ? "interface_body" : "class_body", bodyStart, endOf(declaration),
                declaration.getMembers()));
        return b.build();
    }

    private SyntaxNode enumDeclaration(EnumDeclaration declaration) {
        SimpleSyntaxNode.Builder b = node("enum_declaration", declaration);
        modifiers(b, declaration.getModifiers());
        b.child("name", identifier(declaration.getName()));

        SimpleSyntaxNode.Builder body = node("enum_body", braceAfter(declaration.getName(), declaration), endOf(declaration));
        for (EnumConstantDeclaration constant : declaration.getEntries()) {
            SimpleSyntaxNode.Builder c = node("enum_constant", constant).child("name", identifier(constant.getName()));
            if (!constant.getArguments().isEmpty()) {
                c.child("arguments", argumentList(constant.getArguments(), endOf(constant.getName())));
            }
            body.child(c.build());
        }
        NodeList<BodyDeclaration<?>> members = declaration.getMembers();
        if (!members.isEmpty()) {
            SimpleSyntaxNode.Builder declarations = node("enum_body_declarations",
                    startOf(members.get(0)), endOf(members.get(members.size() - 1)));
            for (BodyDeclaration<?> member : members) {
                declarations.child(member(member));
            }
            body.child(declarations.build());
        }
        return b.child("body", body.build()).build();
    }

    private SyntaxNode recordDeclaration(RecordDeclaration declaration) {
        SimpleSyntaxNode.Builder b = node("record_declaration", declaration);
        modifiers(b, declaration.getModifiers());
        b.child("name", identifier(declaration.getName()));
        SyntaxNode parameters = formalParameters(declaration.getParameters(), endOf(declaration.getName()));
        b.child("parameters", parameters);
        int open = source.indexOf('{', source.offset(parameters.getEndPosition()));
        Position bodyStart = open >= 0 ? source.position(open) : startOf(declaration);
        b.child("body", classBody("class_body", bodyStart, endOf(declaration), declaration.getMembers()));
        return b.build();
    }

    private SyntaxNode classBody(String type, Position start, Position end, NodeList<BodyDeclaration<?>> members) {
        SimpleSyntaxNode.Builder body = node(type, start, end);
        for (BodyDeclaration<?> member : members) {
            body.child(member(member));
        }
        return body.build();
    }

    private SyntaxNode member(BodyDeclaration<?> member) {
        if (member instanceof TypeDeclaration<?> type) {
            return typeDeclaration(type);
        }
        if (member instanceof FieldDeclaration field) {
            SimpleSyntaxNode.Builder b = node("field_declaration", field);
            modifiers(b, field.getModifiers());
            b.child("type", type(field.getElementType()));
            for (VariableDeclarator variable : field.getVariables()) {
                b.child("declarator", declarator(variable));
            }
            return b.build();
        }
        if (member instanceof MethodDeclaration method) {
            SimpleSyntaxNode.Builder b = node("method_declaration", method);
            modifiers(b, method.getModifiers());
            b.child("type", type(method.getType()));
            b.child("name", identifier(method.getName()));
            b.child("parameters", formalParameters(method.getParameters(), endOf(method.getName())));
            method.getBody().ifPresent(body -> b.child("body", block("block", body)));
            return b.build();
        }
        if (member instanceof ConstructorDeclaration constructor) {
            SimpleSyntaxNode.Builder b = node("constructor_declaration", constructor);
            modifiers(b, constructor.getModifiers());
            b.child("name", identifier(constructor.getName()));
            b.child("parameters", formalParameters(constructor.getParameters(), endOf(constructor.getName())));
            b.child("body", block("constructor_body", constructor.getBody()));
            return b.build();
        }
        if (member instanceof CompactConstructorDeclaration constructor) {
            SimpleSyntaxNode.Builder b = node("compact_constructor_declaration", constructor);
            modifiers(b, constructor.getModifiers());
            b.child("name", identifier(constructor.getName()));
            b.child("body", block("block", constructor.getBody()));
            return b.build();
        }
        if (member instanceof InitializerDeclaration initializer) {
            SyntaxNode body = block("block", initializer.getBody());
            return initializer.isStatic()
                    ? node("static_initializer", initializer).child(body).build()
                    : body;
        }
        return generic(member);
    }

    private SyntaxNode formalParameters(NodeList<Parameter> parameters, Position after) {
        int open = source.indexOf('(', source.offset(after));
        int close = source.matchingClose(open);
        Position start = open >= 0 ? source.position(open) : after;
        Position end = close >= 0 ? source.position(close + 1) : after;
        SimpleSyntaxNode.Builder list = node("formal_parameters", start, end);
        for (Parameter parameter : parameters) {
            list.child(parameter(parameter));
        }
        return list.build();
    }

    private SyntaxNode parameter(Parameter parameter) {
        SimpleSyntaxNode.Builder b = node(parameter.isVarArgs() ? "spread_parameter" : "formal_parameter", parameter);
        modifiers(b, parameter.getModifiers());
        if (!(parameter.getType() instanceof UnknownType)) {
            b.child("type", type(parameter.getType()));
        }
        return b.child("name", identifier(parameter.getName())).build();
    }

    private SyntaxNode declarator(VariableDeclarator variable) {
        SimpleSyntaxNode.Builder b = node("variable_declarator", variable).child("name", identifier(variable.getName()));
        variable.getInitializer().ifPresent(value -> b.child("value", expression(value)));
        return b.build();
    }

    private SyntaxNode localVariable(VariableDeclarationExpr declaration, Node span) {
        SimpleSyntaxNode.Builder b = node("local_variable_declaration", span);
        modifiers(b, declaration.getModifiers());
        b.child("type", type(declaration.getElementType()));
        for (VariableDeclarator variable : declaration.getVariables()) {
            b.child("declarator", declarator(variable));
        }
        return b.build();
    }

    /** Keyword modifiers as one {@code modifiers} leaf. */
    private void modifiers(SimpleSyntaxNode.Builder b, NodeList<Modifier> modifiers) {
        if (modifiers.isEmpty()) {
            return;
        }
        b.child(node("modifiers", startOf(modifiers.get(0)), endOf(modifiers.get(modifiers.size() - 1))).build());
    }

    // ------------------------------------------------------------------
    // statements
    // ------------------------------------------------------------------

    private SyntaxNode statement(Statement statement) {
        if (statement instanceof BlockStmt block) {
            return block("block", block);
        }
        if (statement instanceof ExpressionStmt expressionStmt) {
            if (expressionStmt.getExpression() instanceof VariableDeclarationExpr declaration) {
                return localVariable(declaration, expressionStmt);
            }
            return node("expression_statement", expressionStmt)
                    .child(expression(expressionStmt.getExpression()))
                    .build();
        }
        if (statement instanceof IfStmt ifStmt) {
            SimpleSyntaxNode.Builder b = node("if_statement", ifStmt)
                    .child("condition", parenthesized(ifStmt.getCondition()))
                    .child("consequence", statement(ifStmt.getThenStmt()));
            ifStmt.getElseStmt().ifPresent(alternative -> b.child("alternative", statement(alternative)));
            return b.build();
        }
        if (statement instanceof WhileStmt whileStmt) {
            return node("while_statement", whileStmt)
                    .child("condition", parenthesized(whileStmt.getCondition()))
                    .child("body", statement(whileStmt.getBody()))
                    .build();
        }
        if (statement instanceof DoStmt doStmt) {
            return node("do_statement", doStmt)
                    .child("body", statement(doStmt.getBody()))
                    .child("condition", parenthesized(doStmt.getCondition()))
                    .build();
        }
        if (statement instanceof ForStmt forStmt) {
            SimpleSyntaxNode.Builder b = node("for_statement", forStmt);
            for (Expression init : forStmt.getInitialization()) {
                b.child("init", init instanceof VariableDeclarationExpr declaration
                        ? localVariable(declaration, declaration)
                        : expression(init));
            }
            forStmt.getCompare().ifPresent(condition -> b.child("condition", expression(condition)));
            for (Expression update : forStmt.getUpdate()) {
                b.child("update", expression(update));
            }
            return b.child("body", statement(forStmt.getBody())).build();
        }
        if (statement instanceof ForEachStmt forEach) {
            VariableDeclarationExpr variable = forEach.getVariable();
            SimpleSyntaxNode.Builder b = node("enhanced_for_statement", forEach);
            modifiers(b, variable.getModifiers());
            return b.child("type", type(variable.getElementType()))
                    .child("name", identifier(variable.getVariables().get(0).getName()))
                    .child("value", expression(forEach.getIterable()))
                    .child("body", statement(forEach.getBody()))
                    .build();
        }
        if (statement instanceof SwitchStmt switchStmt) {
            return node("switch_statement", switchStmt)
                    .child("condition", parenthesized(switchStmt.getSelector()))
                    .child("body", switchBlock(switchStmt.getEntries(), endOf(switchStmt.getSelector()), endOf(switchStmt)))
                    .build();
        }
        if (statement instanceof BreakStmt breakStmt) {
            SimpleSyntaxNode.Builder b = node("break_statement", breakStmt);
            breakStmt.getLabel().ifPresent(label -> b.child(identifier(label)));
            return b.build();
        }
        if (statement instanceof ContinueStmt continueStmt) {
            SimpleSyntaxNode.Builder b = node("continue_statement", continueStmt);
            continueStmt.getLabel().ifPresent(label -> b.child(identifier(label)));
            return b.build();
        }
        if (statement instanceof ReturnStmt returnStmt) {
            SimpleSyntaxNode.Builder b = node("return_statement", returnStmt);
            returnStmt.getExpression().ifPresent(value -> b.child(expression(value)));
            return b.build();
        }
        if (statement instanceof ThrowStmt throwStmt) {
            return node("throw_statement", throwStmt).child(expression(throwStmt.getExpression())).build();
        }
        if (statement instanceof TryStmt tryStmt) {
            return tryStatement(tryStmt);
        }
        if (statement instanceof LabeledStmt labeled) {
            return node("labeled_statement", labeled)
                    .child("label", identifier(labeled.getLabel()))
                    .child(statement(labeled.getStatement()))
                    .build();
        }
        if (statement instanceof SynchronizedStmt synchronizedStmt) {
            return node("synchronized_statement", synchronizedStmt)
                    .child(parenthesized(synchronizedStmt.getExpression()))
                    .child("body", block("block", synchronizedStmt.getBody()))
                    .build();
        }
        if (statement instanceof AssertStmt assertStmt) {
            SimpleSyntaxNode.Builder b = node("assert_statement", assertStmt).child(expression(assertStmt.getCheck()));
            assertStmt.getMessage().ifPresent(message -> b.child(expression(message)));
            return b.build();
        }
        if (statement instanceof YieldStmt yieldStmt) {
            return node("yield_statement", yieldStmt).child(expression(yieldStmt.getExpression())).build();
        }
        if (statement instanceof LocalClassDeclarationStmt local) {
            return classOrInterface(local.getClassDeclaration());
        }
        if (statement instanceof LocalRecordDeclarationStmt local) {
            return recordDeclaration(local.getRecordDeclaration());
        }
        if (statement instanceof ExplicitConstructorInvocationStmt invocation) {
            return node("explicit_constructor_invocation", invocation)
                    .child("arguments", argumentList(invocation.getArguments(), startOf(invocation)))
                    .build();
        }
        if (statement instanceof EmptyStmt empty) {
            return leaf("empty_statement", empty);
        }
        return generic(statement);
    }

    private SyntaxNode block(String type, BlockStmt block) {
        SimpleSyntaxNode.Builder b = node(type, block);
        for (Statement statement : block.getStatements()) {
            if (!(statement instanceof EmptyStmt)) {
                b.child(statement(statement));
            }
        }
        return b.build();
    }

    /**
     * Old-style entries become {@code switch_block_statement_group}s, arrow entries
     * {@code switch_rule}s. Each starts with a {@code switch_label}.
     */
    private SyntaxNode switchBlock(NodeList<SwitchEntry> entries, Position after, Position end) {
        int open = source.indexOf('{', source.offset(after));
        SimpleSyntaxNode.Builder body = node("switch_block", open >= 0 ? source.position(open) : after, end);
        for (SwitchEntry entry : entries) {
            if (entry.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
                SimpleSyntaxNode.Builder group = node("switch_block_statement_group", entry).child(switchLabel(entry));
                for (Statement statement : entry.getStatements()) {
                    if (!(statement instanceof EmptyStmt)) {
                        group.child(statement(statement));
                    }
                }
                body.child(group.build());
            } else {
                SimpleSyntaxNode.Builder rule = node("switch_rule", entry).child(switchLabel(entry));
                if (!entry.getStatements().isEmpty()) {
                    rule.child("body", statement(entry.getStatements().get(0)));
                }
                body.child(rule.build());
            }
        }
        return body.build();
    }

    private SyntaxNode switchLabel(SwitchEntry entry) {
        Position start = startOf(entry);
        NodeList<Expression> labels = entry.getLabels();
        if (labels.isEmpty()) {
            return node("switch_label", start, source.position(source.offset(start) + "default".length())).build();
        }
        SimpleSyntaxNode.Builder label = node("switch_label", start, endOf(labels.get(labels.size() - 1)));
        for (Expression value : labels) {
            label.child(expression(value));
        }
        return label.build();
    }

    private SyntaxNode tryStatement(TryStmt tryStmt) {
        boolean withResources = !tryStmt.getResources().isEmpty();
        SimpleSyntaxNode.Builder b = node(withResources ? "try_with_resources_statement" : "try_statement", tryStmt);
        if (withResources) {
            int open = source.indexOf('(', source.offset(startOf(tryStmt)));
            int close = source.matchingClose(open);
            SimpleSyntaxNode.Builder resources = open >= 0 && close >= 0
                    ? node("resource_specification", source.position(open), source.position(close + 1))
                    : node("resource_specification", tryStmt.getResources().get(0));
            for (Expression resource : tryStmt.getResources()) {
                resources.child(resource instanceof VariableDeclarationExpr declaration
                        ? localVariable(declaration, declaration)
                        : expression(resource));
            }
            b.child("resources", resources.build());
        }
        b.child("body", block("block", tryStmt.getTryBlock()));
        for (CatchClause clause : tryStmt.getCatchClauses()) {
            Parameter parameter = clause.getParameter();
            SimpleSyntaxNode.Builder formal = node("catch_formal_parameter", parameter);
            modifiers(formal, parameter.getModifiers());
            formal.child(leaf("catch_type", parameter.getType()));
            formal.child("name", identifier(parameter.getName()));
            b.child(node("catch_clause", clause)
                    .child(formal.build())
                    .child("body", block("block", clause.getBody()))
                    .build());
        }
        tryStmt.getFinallyBlock().ifPresent(finallyBlock -> {
            Position start = source.position(source.keywordBefore(source.offset(startOf(finallyBlock)), "finally"));
            b.child(node("finally_clause", start, endOf(finallyBlock))
                    .child("body", block("block", finallyBlock))
                    .build());
        });
        return b.build();
    }

    // ------------------------------------------------------------------
    // expressions
    // ------------------------------------------------------------------

    private SyntaxNode expression(Expression expression) {
        if (expression instanceof NameExpr name) {
            return leaf("identifier", name);
        }
        if (expression instanceof FieldAccessExpr access) {
            return node("field_access", access)
                    .child("object", expression(access.getScope()))
                    .child("field", identifier(access.getName()))
                    .build();
        }
        if (expression instanceof MethodCallExpr call) {
            SimpleSyntaxNode.Builder b = node("method_invocation", call);
            call.getScope().ifPresent(scope -> b.child("object", expression(scope)));
            return b.child("name", identifier(call.getName()))
                    .child("arguments", argumentList(call.getArguments(), endOf(call.getName())))
                    .build();
        }
        if (expression instanceof ObjectCreationExpr creation) {
            SimpleSyntaxNode.Builder b = node("object_creation_expression", creation).child("type", type(creation.getType()));
            SyntaxNode arguments = argumentList(creation.getArguments(), endOf(creation.getType()));
            b.child("arguments", arguments);
            creation.getAnonymousClassBody().ifPresent(members -> {
                int open = source.indexOf('{', source.offset(arguments.getEndPosition()));
                Position start = open >= 0 ? source.position(open) : arguments.getEndPosition();
                b.child(classBody("class_body", start, endOf(creation), members));
            });
            return b.build();
        }
        if (expression instanceof AssignExpr assign) {
            return node("assignment_expression", assign)
                    .child("left", expression(assign.getTarget()))
                    .child("operator", operator(assign.getOperator().asString(), assign.getTarget(), assign.getValue()))
                    .child("right", expression(assign.getValue()))
                    .build();
        }
        if (expression instanceof UnaryExpr unary) {
            String name = unary.getOperator().name();
            if (name.endsWith("INCREMENT") || name.endsWith("DECREMENT")) {
                return node("update_expression", unary).child(expression(unary.getExpression())).build();
            }
            SyntaxNode operand = expression(unary.getExpression());
            int at = source.offset(startOf(unary));
            String symbol = unary.getOperator().asString();
            return node("unary_expression", unary)
                    .child("operator", node(symbol, source.position(at), source.position(at + symbol.length())).build())
                    .child("operand", operand)
                    .build();
        }
        if (expression instanceof BinaryExpr binary) {
            return node("binary_expression", binary)
                    .child("left", expression(binary.getLeft()))
                    .child("operator", operator(binary.getOperator().asString(), binary.getLeft(), binary.getRight()))
                    .child("right", expression(binary.getRight()))
                    .build();
        }
        if (expression instanceof ConditionalExpr conditional) {
            return node("ternary_expression", conditional)
                    .child("condition", expression(conditional.getCondition()))
                    .child("consequence", expression(conditional.getThenExpr()))
                    .child("alternative", expression(conditional.getElseExpr()))
                    .build();
        }
        if (expression instanceof EnclosedExpr enclosed) {
            return node("parenthesized_expression", enclosed).child(expression(enclosed.getInner())).build();
        }
        if (expression instanceof LambdaExpr lambda) {
            return lambda(lambda);
        }
        if (expression instanceof MethodReferenceExpr reference) {
            return node("method_reference", reference).child(expression(reference.getScope())).build();
        }
        if (expression instanceof CastExpr cast) {
            return node("cast_expression", cast)
                    .child("type", type(cast.getType()))
                    .child("value", expression(cast.getExpression()))
                    .build();
        }
        if (expression instanceof InstanceOfExpr instanceOf) {
            return node("instanceof_expression", instanceOf)
                    .child("left", expression(instanceOf.getExpression()))
                    .child("right", type(instanceOf.getType()))
                    .build();
        }
        if (expression instanceof ArrayAccessExpr access) {
            return node("array_access", access)
                    .child("array", expression(access.getName()))
                    .child("index", expression(access.getIndex()))
                    .build();
        }
        if (expression instanceof ArrayCreationExpr creation) {
            SimpleSyntaxNode.Builder b = node("array_creation_expression", creation).child("type", type(creation.getElementType()));
            for (ArrayCreationLevel level : creation.getLevels()) {
                level.getDimension().ifPresent(dimension -> b.child("dimensions", expression(dimension)));
            }
            creation.getInitializer().ifPresent(initializer -> b.child("value", expression(initializer)));
            return b.build();
        }
        if (expression instanceof ArrayInitializerExpr initializer) {
            SimpleSyntaxNode.Builder b = node("array_initializer", initializer);
            for (Expression value : initializer.getValues()) {
                b.child(expression(value));
            }
            return b.build();
        }
        if (expression instanceof VariableDeclarationExpr declaration) {
            return localVariable(declaration, declaration);
        }
        if (expression instanceof SwitchExpr switchExpr) {
            return node("switch_expression", switchExpr)
                    .child("condition", parenthesized(switchExpr.getSelector()))
                    .child("body", switchBlock(switchExpr.getEntries(), endOf(switchExpr.getSelector()), endOf(switchExpr)))
                    .build();
        }
        if (expression instanceof TypeExpr typeExpr) {
            return type(typeExpr.getType());
        }
        if (expression instanceof ThisExpr) {
            return leaf("this", expression);
        }
        if (expression instanceof SuperExpr) {
            return leaf("super", expression);
        }
        if (expression instanceof ClassExpr) {
            return leaf("class_literal", expression);
        }
        if (expression instanceof NullLiteralExpr) {
            return leaf("null_literal", expression);
        }
        if (expression instanceof BooleanLiteralExpr literal) {
            return leaf(literal.getValue() ? "true" : "false", literal);
        }
        if (expression instanceof StringLiteralExpr || expression instanceof TextBlockLiteralExpr) {
            return leaf("string_literal", expression);
        }
        if (expression instanceof CharLiteralExpr) {
            return leaf("character_literal", expression);
        }
        if (expression instanceof IntegerLiteralExpr || expression instanceof LongLiteralExpr) {
            return leaf("decimal_integer_literal", expression);
        }
        if (expression instanceof DoubleLiteralExpr) {
            return leaf("decimal_floating_point_literal", expression);
        }
        return generic(expression);
    }

    /**
     * A single unparenthesized inferred parameter is the {@code parameters} identifier itself;
     * otherwise {@code inferred_parameters} or {@code formal_parameters}.
     */
    private SyntaxNode lambda(LambdaExpr lambda) {
        SimpleSyntaxNode.Builder b = node("lambda_expression", lambda);
        NodeList<Parameter> parameters = lambda.getParameters();
        boolean inferred = parameters.stream().allMatch(p -> p.getType() instanceof UnknownType);

        if (parameters.size() == 1 && inferred && !lambda.isEnclosingParameters()) {
            b.child("parameters", identifier(parameters.get(0).getName()));
        } else {
            int open = source.offset(startOf(lambda));
            int close = source.matchingClose(open);
            Position start = startOf(lambda);
            Position end = close >= 0 ? source.position(close + 1) : start;
            SimpleSyntaxNode.Builder list = node(inferred ? "inferred_parameters" : "formal_parameters", start, end);
            for (Parameter parameter : parameters) {
                list.child(inferred ? identifier(parameter.getName()) : parameter(parameter));
            }
            b.child("parameters", list.build());
        }

        Statement body = lambda.getBody();
        if (body instanceof ExpressionStmt expressionBody) {
            b.child("body", expression(expressionBody.getExpression()));
        } else {
            b.child("body", statement(body));
        }
        return b.build();
    }

    private SyntaxNode argumentList(NodeList<Expression> arguments, Position after) {
        int open = source.indexOf('(', source.offset(after));
        int close = source.matchingClose(open);
        SimpleSyntaxNode.Builder list = open >= 0 && close >= 0
                ? node("argument_list", source.position(open), source.position(close + 1))
                : node("argument_list", after, after);
        for (Expression argument : arguments) {
            list.child(expression(argument));
        }
        return list.build();
    }

    /** Wraps a condition with the parentheses the statement syntax puts around it. */
    private SyntaxNode parenthesized(Expression condition) {
        int before = source.previousNonSpace(source.offset(startOf(condition)));
        int after = source.nextNonSpace(source.offset(endOf(condition)));
        SimpleSyntaxNode.Builder b = source.charAt(before) == '(' && source.charAt(after) == ')'
                ? node("parenthesized_expression", source.position(before), source.position(after + 1))
                : node("parenthesized_expression", condition);
        return b.child(expression(condition)).build();
    }

    /** Operator token between two operands, typed by its own text as tree-sitter does. */
    private SyntaxNode operator(String symbol, Node left, Node right) {
        int from = source.offset(endOf(left));
        int at = source.indexOf(symbol, from, source.offset(startOf(right)));
        if (at < 0) {
            return node(symbol, endOf(left), endOf(left)).build();
        }
        return node(symbol, source.position(at), source.position(at + symbol.length())).build();
    }

    // ------------------------------------------------------------------
    // names and types
    // ------------------------------------------------------------------

    private SyntaxNode identifier(Node name) {
        return leaf("identifier", name);
    }

    private SyntaxNode name(Name name) {
        return leaf(name.getQualifier().isPresent() ? "scoped_identifier" : "identifier", name);
    }

    /** Types are leaves: names inside them never count as variable references. */
    private SyntaxNode type(Type type) {
        String kind;
        if (type instanceof VoidType) {
            kind = "void_type";
        } else if (type instanceof PrimitiveType primitive) {
            switch (primitive.getType()) {
                case BOOLEAN:
                    kind = "boolean_type";
                    break;
                case FLOAT:
                case DOUBLE:
                    kind = "floating_point_type";
                    break;
                default:
                    kind = "integral_type";
                    break;
            }
        } else if (type instanceof ArrayType) {
            kind = "array_type";
        } else if (type instanceof ClassOrInterfaceType classType) {
            if (classType.getTypeArguments().isPresent()) {
                kind = "generic_type";
            } else if (classType.getScope().isPresent()) {
                kind = "scoped_type_identifier";
            } else {
                kind = "type_identifier";
            }
        } else if (type instanceof UnionType) {
            kind = "union_type";
        } else {
            kind = "type_identifier";
        }
        return leaf(kind, type);
    }

    private SyntaxNode typeList(String kind, NodeList<ClassOrInterfaceType> types) {
        SimpleSyntaxNode.Builder b = node(kind, startOf(types.get(0)), endOf(types.get(types.size() - 1)));
        for (ClassOrInterfaceType type : types) {
            b.child(type(type));
        }
        return b.build();
    }

    /** Anything without a dedicated mapping: snake_case tag, children converted in order. */
    private SyntaxNode generic(Node node) {
        SimpleSyntaxNode.Builder b = node(tagFor(node.getClass().getSimpleName()), node);
        for (Node child : node.getChildNodes()) {
            if (child instanceof Comment || child instanceof Modifier || child instanceof AnnotationExpr) {
                continue;
            }
            b.child(convert(child));
        }
        return b.build();
    }

    static String tagFor(String className) {
        String base = className;
        String suffix = "";
        if (base.endsWith("Expr")) {
            base = base.substring(0, base.length() - "Expr".length());
            suffix = "_expression";
        } else if (base.endsWith("Stmt")) {
            base = base.substring(0, base.length() - "Stmt".length());
            suffix = "_statement";
        }
        StringBuilder tag = new StringBuilder();
        for (int i = 0; i < base.length(); i++) {
            char c = base.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    tag.append('_');
                }
                tag.append(Character.toLowerCase(c));
            } else {
                tag.append(c);
            }
        }
        return tag + suffix;
    }

    // ------------------------------------------------------------------
    // spans
    // ------------------------------------------------------------------

    private SimpleSyntaxNode.Builder node(String type, Node node) {
        return node(type, startOf(node), endOf(node));
    }

    private SimpleSyntaxNode.Builder node(String type, Position start, Position end) {
        return SimpleSyntaxNode.builder(type).span(start, end).text(source.slice(start, end));
    }

    private SyntaxNode leaf(String type, Node node) {
        return node(type, node).build();
    }

    private Position startOf(Node node) {
        return node.getRange().map(r -> source.start(r.begin)).orElse(Position.ORIGIN);
    }

    private Position endOf(Node node) {
        return node.getRange().map(r -> source.end(r.end)).orElseGet(() -> startOf(node));
    }

    private Position braceAfter(Node header, Node declaration) {
        int open = source.indexOf('{', source.offset(endOf(header)));
        return open >= 0 ? source.position(open) : startOf(declaration);
    }
}
