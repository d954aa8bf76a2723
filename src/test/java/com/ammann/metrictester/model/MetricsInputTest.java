/* (C)2026 */
package com.ammann.metrictester.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.support.TestDataFactory;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricsInputTest {

    @Test
    void keepsEmptyColumnsInPrunedTree() {
        CommunityDataMatrix cdm = CommunityDataMatrix.of(
                List.of("1", "2"), List.of("a", "b", "c"), new double[][] {{1, 0, 0}, {0, 0, 1}});

        MetricsInput input = MetricsInput.prepare(cdm, TestDataFactory.balancedTree());

        assertThat(input.tree().tipLabels()).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(input.tree().rootDistance("a")).isEqualTo(2.0);
        assertThat(input.presentTips(0)).hasSize(1);
        assertThat(input.tipLabel(input.presentTips(1)[0])).isEqualTo("c");
        assertThat(input.distance(input.presentTips(0)[0], input.presentTips(1)[0])).isEqualTo(4.0);
    }

    @Test
    void zeroAbundanceMatrixStillPrunesToItsColumns() {
        CommunityDataMatrix empty = CommunityDataMatrix.of(List.of("1"), List.of("a"), new double[][] {{0}});

        MetricsInput input = MetricsInput.prepare(empty, TestDataFactory.balancedTree());

        assertThat(input.tree().tipLabels()).containsExactly("a");
        assertThat(input.presentTips(0)).isEmpty();
    }

    @Test
    void matrixWithoutColumnsHasNoTree() {
        CommunityDataMatrix bare = CommunityDataMatrix.of(List.of("1"), List.of(), new double[][] {{}});

        MetricsInput input = MetricsInput.prepare(bare, TestDataFactory.balancedTree());

        assertThat(input.tree()).isNull();
        assertThat(input.presentTips(0)).isEmpty();
    }

    @Test
    void rejectsSpeciesMissingFromTree() {
        CommunityDataMatrix cdm = CommunityDataMatrix.of(List.of("1"), List.of("a", "x"), new double[][] {{1, 1}});

        assertThatThrownBy(() -> MetricsInput.prepare(cdm, TestDataFactory.balancedTree()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not tips of the tree")
                .hasMessageContaining("x");
    }

    @Test
    void rejectsMissingArguments() {
        assertThatThrownBy(() -> MetricsInput.prepare(null, TestDataFactory.balancedTree()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> MetricsInput.prepare(TestDataFactory.threeUnitMatrix(), null))
                .isInstanceOf(ValidationException.class);
    }
}
