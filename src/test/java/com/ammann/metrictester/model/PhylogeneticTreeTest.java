/* (C)2026 */
package com.ammann.metrictester.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.PhylogeneticTree.Node;
import com.ammann.metrictester.support.TestDataFactory;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PhylogeneticTreeTest {

    private final PhylogeneticTree tree = TestDataFactory.balancedTree();

    @Test
    void parsesTipsInOrder() {
        assertThat(tree.tipLabels()).containsExactly("a", "b", "c", "d");
        assertThat(tree.tipCount()).isEqualTo(4);
        assertThat(tree.rootDistance("c")).isEqualTo(2.0);
    }

    @Test
    void sharedPathLengthsHoldRootDistanceOnDiagonal() {
        double[][] vcv = tree.sharedPathLengths(List.of("a", "b", "c"));

        assertThat(vcv[0]).containsExactly(2.0, 1.0, 0.0);
        assertThat(vcv[1]).containsExactly(1.0, 2.0, 0.0);
        assertThat(vcv[2]).containsExactly(0.0, 0.0, 2.0);
    }

    @Test
    void correlationAndCopheneticMatricesFollowTopology() {
        double[][] correlation = tree.correlationMatrix(List.of("a", "b", "d"));
        double[][] distances = tree.copheneticDistances(List.of("a", "b", "d"));

        assertThat(correlation[0][1]).isEqualTo(0.5);
        assertThat(correlation[0][2]).isEqualTo(0.0);
        assertThat(correlation[2][2]).isEqualTo(1.0);
        assertThat(distances[0][1]).isEqualTo(2.0);
        assertThat(distances[1][2]).isEqualTo(4.0);
        assertThat(distances[2][2]).isEqualTo(0.0);
    }

    @Test
    void phylogeneticDiversityIncludesRootPath() {
        assertThat(tree.phylogeneticDiversity(List.of("a", "b"))).isEqualTo(3.0);
        assertThat(tree.phylogeneticDiversity(List.of("a", "c"))).isEqualTo(4.0);
        assertThat(tree.phylogeneticDiversity(List.of("d"))).isEqualTo(2.0);
        assertThat(tree.phylogeneticDiversity(List.of())).isEqualTo(0.0);
    }

    @Test
    void pruneCollapsesUnaryNodesAndMovesRoot() {
        PhylogeneticTree pruned = tree.prune(List.of("a", "c"));

        assertThat(pruned.tipLabels()).containsExactlyInAnyOrder("a", "c");
        assertThat(pruned.copheneticDistances(List.of("a", "c"))[0][1]).isEqualTo(4.0);
        assertThat(pruned.rootDistance("a")).isEqualTo(2.0);
    }

    @Test
    void pruneToOneCherryRootsAtItsAncestor() {
        PhylogeneticTree pruned = tree.prune(List.of("a", "b"));

        assertThat(pruned.rootDistance("a")).isEqualTo(1.0);
        assertThat(pruned.correlationMatrix(List.of("a", "b"))[0][1]).isEqualTo(0.0);
    }

    @Test
    void treeWithoutLengthsGetsUnitLengths() {
        PhylogeneticTree unit = PhylogeneticTree.fromNewick("((a,b),c);");

        assertThat(unit.rootDistance("a")).isEqualTo(2.0);
        assertThat(unit.rootDistance("c")).isEqualTo(1.0);
    }

    @Test
    void treeWithPartialLengthsIsRejected() {
        assertThatThrownBy(() -> PhylogeneticTree.fromNewick("((a:1,b),c:1);"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("give all or none");
    }

    @Test
    void parsesQuotedLabelsAndComments() {
        PhylogeneticTree parsed = PhylogeneticTree.fromNewick("('Quercus alba':1.5,[note]'it''s':0.5)root");

        assertThat(parsed.tipLabels()).containsExactly("Quercus alba", "it's");
        assertThat(parsed.rootDistance("Quercus alba")).isCloseTo(1.5, within(1e-12));
    }

    @ParameterizedTest
    @ValueSource(strings = {"((a:1,b:1);", "(a:1,b:x);", "(a:1,:1);", "(a,b)c;extra", "   "})
    void malformedNewickIsRejected(String newick) {
        assertThatThrownBy(() -> PhylogeneticTree.fromNewick(newick))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void duplicateTipLabelsAreRejected() {
        assertThatThrownBy(() -> PhylogeneticTree.fromNewick("(a:1,a:1);"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unique label");
    }

    @Test
    void unknownTipIsRejected() {
        assertThatThrownBy(() -> tree.prune(List.of("a", "z")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'z'");
    }

    @Test
    void buildsFromNodes() {
        PhylogeneticTree built = PhylogeneticTree.of(
                Node.internal(0.0, Node.tip("x", 1.0), Node.internal(1.0, Node.tip("y", 2.0), Node.tip("z", 2.0))));

        assertThat(built.copheneticDistances(List.of("x", "y", "z"))[0][1]).isEqualTo(4.0);
        assertThat(built.copheneticDistances(List.of("x", "y", "z"))[1][2]).isEqualTo(4.0);
    }
}
