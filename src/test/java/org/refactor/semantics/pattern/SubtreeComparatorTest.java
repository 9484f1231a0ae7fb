package org.refactor.semantics.pattern;

import org.junit.jupiter.api.Test;
import org.refactor.semantics.tree.SyntaxNode;
import org.refactor.semantics.tree.Trees;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.refactor.semantics.tree.Trees.block;
import static org.refactor.semantics.tree.Trees.id;
import static org.refactor.semantics.tree.Trees.ifThen;
import static org.refactor.semantics.tree.Trees.leaf;
import static org.refactor.semantics.tree.Trees.program;
import static org.refactor.semantics.tree.Trees.use;

class SubtreeComparatorTest {

    private final SubtreeComparator comparator = new SubtreeComparator();

    @Test
    void nodeComparedWithItselfIsIdentical() {
        SyntaxNode node = program(ifThen(id("ready"), block(use("go"))), use("done"));

        SubtreeCompareResult result = comparator.compareSubtrees(node, node);

        assertThat(result.similarity).isEqualTo(1.0);
        assertThat(result.differences).isEmpty();
        assertThat(result.identical).isTrue();
        assertThat(result.stats.differentNodes()).isZero();
        assertThat(result.stats.nodesCompared()).isEqualTo(result.stats.matchingNodes());
    }

    @Test
    void positionsDoNotMatter() {
        SyntaxNode first = program(use("a"));
        SyntaxNode second = program(use("b"), use("a")).getChildren().get(1);

        SubtreeCompareResult result = comparator.compareSubtrees(first.getChildren().get(0), second);

        assertThat(result.identical).isTrue();
    }

    @Test
    void textMismatchPenalizesEveryLevel() {
        SubtreeCompareResult result = comparator.compareSubtrees(program(use("x")), program(use("y")));

        // 0.8 at each of the three levels
        assertThat(result.similarity).isCloseTo(0.512, within(1e-9));
        assertThat(result.differences).extracting(d -> d.type)
                .containsOnly(DifferenceType.TEXT_MISMATCH)
                .hasSize(3);
        assertThat(result.differences.get(2).path1).containsExactly(0, 0);
        assertThat(result.stats).isEqualTo(new SubtreeCompareResult.Stats(3, 0, 3));
        assertThat(result.identical).isFalse();
    }

    @Test
    void ignoringTextMakesRenamedTreesIdentical() {
        SubtreeCompareResult result = comparator.compareSubtrees(program(use("x")), program(use("y")),
                SubtreeCompareOptions.defaults().ignoreText(true));

        assertThat(result.similarity).isEqualTo(1.0);
        assertThat(result.identical).isTrue();
    }

    @Test
    void typeMismatchHalvesSimilarity() {
        SubtreeCompareResult result = comparator.compareSubtrees(
                Trees.build(id("value")), Trees.build(leaf("property_identifier", "value")));

        assertThat(result.similarity).isEqualTo(0.5);
        assertThat(result.differences).singleElement()
                .satisfies(d -> {
                    assertThat(d.type).isEqualTo(DifferenceType.TYPE_MISMATCH);
                    assertThat(d.path1).isEmpty();
                    assertThat(d.description).contains("identifier", "property_identifier");
                });
    }

    @Test
    void childOnlyInFirstTreeIsExtra() {
        SubtreeCompareResult result = comparator.compareSubtrees(
                program(use("x"), use("y")), program(use("x")),
                SubtreeCompareOptions.defaults().ignoreText(true));

        assertThat(result.similarity).isEqualTo(0.5);
        assertThat(result.differences).extracting(d -> d.type)
                .containsExactly(DifferenceType.CHILDREN_COUNT, DifferenceType.EXTRA_CHILD);
        SubtreeDifference extra = result.differences.get(1);
        assertThat(extra.path1).isEqualTo(List.of(1));
        assertThat(extra.path2).isEmpty();
        assertThat(extra.node1.getType()).isEqualTo("expression_statement");
        assertThat(extra.node2).isNull();
    }

    @Test
    void childOnlyInSecondTreeIsMissing() {
        SubtreeCompareResult result = comparator.compareSubtrees(
                program(use("x")), program(use("x"), use("y")),
                SubtreeCompareOptions.defaults().ignoreText(true));

        assertThat(result.similarity).isEqualTo(0.5);
        assertThat(result.differences).extracting(d -> d.type)
                .containsExactly(DifferenceType.CHILDREN_COUNT, DifferenceType.MISSING_CHILD);
        SubtreeDifference missing = result.differences.get(1);
        assertThat(missing.path1).isEmpty();
        assertThat(missing.path2).isEqualTo(List.of(1));
        assertThat(missing.node1).isNull();
        assertThat(missing.node2.getType()).isEqualTo("expression_statement");
    }

    @Test
    void ignoredTypesCountAsMatching() {
        SubtreeCompareResult result = comparator.compareSubtrees(program(use("x")), program(use("y")),
                SubtreeCompareOptions.defaults().ignoreType("expression_statement"));

        // only the program text differs
        assertThat(result.similarity).isCloseTo(0.8, within(1e-9));
        assertThat(result.differences).hasSize(1);
        assertThat(result.stats).isEqualTo(new SubtreeCompareResult.Stats(2, 1, 1));
    }

    @Test
    void ignoredTypeOnEitherSideMatches() {
        SyntaxNode statement = Trees.build(Trees.expr(id("x")));
        SyntaxNode comment = Trees.build(leaf("comment", "// note"));
        SubtreeCompareOptions options = SubtreeCompareOptions.defaults().ignoreType("comment");

        assertThat(comparator.compareSubtrees(statement, comment, options).similarity).isEqualTo(1.0);
        assertThat(comparator.compareSubtrees(comment, statement, options).similarity).isEqualTo(1.0);
    }

    @Test
    void pairsBelowMaxDepthAreNotInspected() {
        SubtreeCompareResult result = comparator.compareSubtrees(program(use("x")), program(use("y")),
                SubtreeCompareOptions.defaults().maxDepth(0));

        assertThat(result.similarity).isCloseTo(0.8, within(1e-9));
        assertThat(result.stats.nodesCompared()).isEqualTo(1);
    }
}
