package org.refactor.semantics.query;

import org.junit.jupiter.api.Test;
import org.refactor.semantics.tree.Position;
import org.refactor.semantics.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.refactor.semantics.tree.Trees.block;
import static org.refactor.semantics.tree.Trees.id;
import static org.refactor.semantics.tree.Trees.ifThen;
import static org.refactor.semantics.tree.Trees.let;
import static org.refactor.semantics.tree.Trees.num;
import static org.refactor.semantics.tree.Trees.program;
import static org.refactor.semantics.tree.Trees.use;

class AstQueryTest {

    private final AstQuery query = new AstQuery();

    /**
     * <pre>
     * 0  program
     * 1    lexical_declaration
     * 2      variable_declarator
     * 3        identifier x
     * 4        number 1
     * 5    if_statement
     * 6      parenthesized_expression
     * 7        identifier x
     * 8      statement_block
     * 9        expression_statement
     * 10         identifier x
     * </pre>
     */
    private final SyntaxNode root = program(
            let("x", num("1")),
            ifThen(id("x"), block(use("x"))));

    @Test
    void findsNodesByType() {
        assertThat(query.findNodesByType(root, "identifier")).hasSize(3);
        assertThat(query.findNodesByType(root, "class_declaration")).isEmpty();
        assertThat(query.findFirstNodeByType(root, "number").getText()).isEqualTo("1");
        assertThat(query.findFirstNodeByType(root, "while_statement")).isNull();
    }

    @Test
    void findsDeepestNodeAtPosition() {
        SyntaxNode found = query.findNodeAtPosition(root, new Position(7, 5));

        assertThat(found.getType()).isEqualTo("identifier");
        assertThat(found.getStartPosition()).isEqualTo(new Position(7, 0));
        assertThat(query.findNodeAtPosition(root, new Position(50, 0))).isNull();
    }

    @Test
    void depthAndParentChain() {
        SyntaxNode condition = query.findNodeAtPosition(root, new Position(7, 0));

        assertThat(query.getNodeDepth(root, root)).isZero();
        assertThat(query.getNodeDepth(root, condition)).isEqualTo(3);
        assertThat(query.getParentChain(root, condition))
                .extracting(SyntaxNode::getType)
                .containsExactly("program", "if_statement", "parenthesized_expression");
        assertThat(query.getParentChain(root, root)).isEmpty();
    }

    @Test
    void foreignNodeIsNotInTree() {
        SyntaxNode other = program(use("y"));

        assertThat(query.getNodeDepth(root, other)).isEqualTo(-1);
        assertThat(query.getParentChain(root, other)).isEmpty();
    }

    @Test
    void descendantsArePreOrder() {
        List<String> types = query.getDescendants(root).stream()
                .map(SyntaxNode::getType)
                .collect(Collectors.toList());

        assertThat(types).hasSize(10);
        assertThat(types.get(0)).isEqualTo("lexical_declaration");
        assertThat(types.get(4)).isEqualTo("if_statement");
        assertThat(query.isLeafNode(root)).isFalse();
        assertThat(query.isLeafNode(query.findFirstNodeByType(root, "number"))).isTrue();
    }

    @Test
    void visitorReturningFalseStopsTraversal() {
        List<String> visited = new ArrayList<>();
        query.traverse(root, (node, parent, depth, path) -> {
            visited.add(node.getType());
            return !node.getType().equals("identifier");
        });

        assertThat(visited).containsExactly("program", "lexical_declaration", "variable_declarator", "identifier");
    }

    @Test
    void visitorSeesParentDepthAndPath() {
        List<List<Integer>> identifierPaths = new ArrayList<>();
        query.traverse(root, (node, parent, depth, path) -> {
            if (depth == 0) {
                assertThat(parent).isNull();
            }
            if (node.getType().equals("identifier")) {
                identifierPaths.add(new ArrayList<>(path));
            }
            return true;
        });

        assertThat(identifierPaths).containsExactly(
                List.of(0, 0, 0),
                List.of(1, 0, 0),
                List.of(1, 1, 0, 0));
    }

    @Test
    void statsCountEveryNode() {
        AstStats stats = query.getStats(root);

        assertThat(stats.nodeCount()).isEqualTo(11).isEqualTo(countRecursively(root));
        assertThat(stats.maxDepth()).isEqualTo(4);
        assertThat(stats.nodesByType()).containsEntry("identifier", 3).containsEntry("program", 1);
        // 10 children spread over 7 interior nodes
        assertThat(stats.avgChildren()).isCloseTo(10.0 / 7, within(1e-9));
    }

    @Test
    void statsOfSingleLeaf() {
        AstStats stats = query.getStats(program());

        assertThat(stats.nodeCount()).isEqualTo(1);
        assertThat(stats.maxDepth()).isZero();
        assertThat(stats.avgChildren()).isZero();
    }

    private static int countRecursively(SyntaxNode node) {
        int count = 1;
        for (SyntaxNode child : node.getChildren()) {
            count += countRecursively(child);
        }
        return count;
    }
}
