package org.refactor.semantics.scope;

import org.refactor.semantics.tree.NodeTypes;
import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;

import java.util.List;
import java.util.Set;

/**
 * Second pass of the semantic analysis: resolves every identifier use against the scope that
 * encloses it. Runs after all declarations are known, so forward references resolve.
 */
class ReferenceResolver {

    /** Subtrees that name things outside the file. */
    private static final Set<String> EXTERNAL_NAMES = Set.of(
            "import_declaration", "package_declaration", "import_statement", "ImportDeclaration");

    private static final Set<String> LABEL_HOLDERS = Set.of(
            "break_statement", "continue_statement", "labeled_statement",
            "BreakStatement", "ContinueStatement", "LabeledStatement");

    private static final Set<String> KEYED_ENTRIES = Set.of("pair", "Property", "PropertyDefinition");

    private final ScopeTree tree;
    private final Set<SyntaxNode> declarationNames;
    private final List<SymbolReference> unresolved;

    ReferenceResolver(ScopeTree tree, Set<SyntaxNode> declarationNames, List<SymbolReference> unresolved) {
        this.tree = tree;
        this.declarationNames = declarationNames;
        this.unresolved = unresolved;
    }

    void resolve(SyntaxNode node, SyntaxNode parent, String scopeId) {
        if (EXTERNAL_NAMES.contains(node.getType())) {
            return;
        }
        Scope own = tree.scopeOf(node);
        String current = own != null ? own.id : scopeId;

        if (NodeTypes.isIdentifier(node) && !declarationNames.contains(node) && !isNonReference(node, parent)) {
            resolveIdentifier(node, parent, current);
        }
        for (SyntaxNode child : node.getChildren()) {
            resolve(child, node, current);
        }
    }

    private void resolveIdentifier(SyntaxNode node, SyntaxNode parent, String scopeId) {
        String name = node.getText();
        SourceLocation location = SourceLocation.of(node);
        SymbolReference reference = isWrite(node, parent)
                ? SymbolReference.write(name, location)
                : SymbolReference.read(name, location);

        SymbolInfo symbol = tree.resolve(name, scopeId);
        if (symbol != null) {
            symbol.references.add(reference);
        } else {
            unresolved.add(reference);
        }
    }

    /** Member names, object keys and statement labels are not variable uses. */
    private static boolean isNonReference(SyntaxNode node, SyntaxNode parent) {
        if (parent == null) {
            return false;
        }
        String type = parent.getType();
        if (LABEL_HOLDERS.contains(type)) {
            return true;
        }
        if (NodeTypes.MEMBER_ACCESSES.contains(type)) {
            return parent.getChildForFieldName("property") == node || parent.getChildForFieldName("field") == node;
        }
        if (NodeTypes.CALLS.contains(type)) {
            return parent.getChildForFieldName("name") == node && parent.getChildForFieldName("object") != null;
        }
        if (KEYED_ENTRIES.contains(type)) {
            return parent.getChildForFieldName("key") == node;
        }
        return false;
    }

    /** Assignment targets (compound assignments included) and update operands. */
    private static boolean isWrite(SyntaxNode node, SyntaxNode parent) {
        if (parent == null) {
            return false;
        }
        String type = parent.getType();
        if (NodeTypes.ASSIGNMENTS.contains(type) || type.equals("augmented_assignment_expression")) {
            SyntaxNode target = parent.getChildForFieldName("left");
            if (target == null && !parent.getChildren().isEmpty()) {
                target = parent.getChildren().get(0);
            }
            return target == node;
        }
        return NodeTypes.UPDATES.contains(type);
    }
}
