/* (C)2026 */
package com.ammann.metrictester.metric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.metrictester.model.CommunityDataMatrix;
import com.ammann.metrictester.model.MetricsInput;
import com.ammann.metrictester.model.PhylogeneticTree;
import com.ammann.metrictester.support.TestDataFactory;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Reference values on two cherries with unit edges: a and b are 2 apart with correlation 0.5,
 * a and c are 4 apart and uncorrelated.
 */
class PhylogeneticMetricsTest {

    private MetricsInput input;

    @BeforeEach
    void setUp() {
        input = MetricsInput.prepare(TestDataFactory.threeUnitMatrix(), TestDataFactory.balancedTree());
    }

    @Test
    void richnessCountsPresentSpecies() {
        assertThat(PhylogeneticMetrics.richness(input)).containsExactly(2.0, 2.0, 1.0);
    }

    @Test
    void psvAndPsrReflectRelatedness() {
        double[] psv = PhylogeneticMetrics.psv(input);
        double[] psr = PhylogeneticMetrics.psr(input);

        assertThat(psv[0]).isCloseTo(0.5, within(1e-12));
        assertThat(psv[1]).isCloseTo(1.0, within(1e-12));
        assertThat(psv[2]).isNaN();
        assertThat(psr[0]).isCloseTo(1.0, within(1e-12));
        assertThat(psr[1]).isCloseTo(2.0, within(1e-12));
        assertThat(psr[2]).isNaN();
    }

    @Test
    void pscUsesClosestRelative() {
        double[] psc = PhylogeneticMetrics.psc(input);

        assertThat(psc[0]).isCloseTo(0.5, within(1e-12));
        assertThat(psc[1]).isCloseTo(1.0, within(1e-12));
        assertThat(psc[2]).isNaN();
    }

    @Test
    void distanceMetricsAreUndefinedBelowTwoSpecies() {
        assertThat(PhylogeneticMetrics.mpd(input)).containsExactly(2.0, 4.0, Double.NaN);
        assertThat(PhylogeneticMetrics.mntd(input)).containsExactly(2.0, 4.0, Double.NaN);
    }

    @Test
    void mntdDiffersFromMpdWhenRelativesAreMixed() {
        CommunityDataMatrix cdm = CommunityDataMatrix.of(
                List.of("1"), List.of("a", "b", "c"), new double[][] {{1, 1, 1}});
        MetricsInput mixed = MetricsInput.prepare(cdm, TestDataFactory.balancedTree());

        assertThat(PhylogeneticMetrics.mpd(mixed)[0]).isCloseTo(10.0 / 3.0, within(1e-12));
        assertThat(PhylogeneticMetrics.mntd(mixed)[0]).isCloseTo(8.0 / 3.0, within(1e-12));
    }

    @Test
    void pdSumsBranchLengths() {
        assertThat(PhylogeneticMetrics.pd(input)).containsExactly(3.0, 4.0, 2.0);
    }

    @Test
    void pdOfEmptyMatrixIsZero() {
        CommunityDataMatrix empty = CommunityDataMatrix.of(List.of("1"), List.of("a"), new double[][] {{0}});

        assertThat(PhylogeneticMetrics.pd(MetricsInput.prepare(empty, TestDataFactory.balancedTree())))
                .containsExactly(0.0);
    }

    @Test
    void unitMetricsDoNotDependOnOtherUnits() {
        PhylogeneticTree tree = PhylogeneticTree.fromNewick("((a:1,b:1):5,c:1);");
        MetricsInput alone = MetricsInput.prepare(CommunityDataMatrix.of(
                List.of("1"), List.of("a", "b", "c"), new double[][] {{1, 1, 0}}), tree);
        MetricsInput withNeighbour = MetricsInput.prepare(CommunityDataMatrix.of(
                List.of("1", "2"), List.of("a", "b", "c"), new double[][] {{1, 1, 0}, {0, 0, 1}}), tree);

        assertThat(PhylogeneticMetrics.psv(alone)[0]).isCloseTo(1.0 / 6.0, within(1e-12));
        assertThat(PhylogeneticMetrics.psv(withNeighbour)[0]).isCloseTo(1.0 / 6.0, within(1e-12));
        assertThat(PhylogeneticMetrics.pd(alone)[0]).isEqualTo(7.0);
        assertThat(PhylogeneticMetrics.pd(withNeighbour)[0]).isEqualTo(7.0);
    }
}
