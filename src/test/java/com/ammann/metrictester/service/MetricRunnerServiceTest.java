/* (C)2026 */
package com.ammann.metrictester.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.metrictester.exception.UnknownRegistryNameException;
import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.metric.CommunityMetric;
import com.ammann.metrictester.model.CommunityDataMatrix;
import com.ammann.metrictester.model.MetricTable;
import com.ammann.metrictester.model.MetricsInput;
import com.ammann.metrictester.model.PhylogeneticTree;
import com.ammann.metrictester.support.TestDataFactory;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricRunnerServiceTest {

    private final MetricRunnerService service = new MetricRunnerService(new MetricRegistry());

    @Test
    void richnessCountsNonZeroCells() {
        CommunityDataMatrix cdm = CommunityDataMatrix.of(
                List.of("1", "2"), List.of("A", "B", "C"), new double[][] {{1, 0, 2}, {0, 0, 0}});
        PhylogeneticTree tree = PhylogeneticTree.fromNewick("(A:1,(B:1,C:1):1);");

        MetricTable table = service.runMetrics(cdm, tree, List.of("richness"));

        assertThat(table.metrics()).containsExactly("richness");
        assertThat(table.column("richness")).containsExactly(2.0, 0.0);
        assertThat(table.rows()).extracting(row -> row.unitId()).containsExactly("1", "2");
    }

    @Test
    void allMetricsWhenNoneRequested() {
        MetricTable table = service.runMetrics(
                TestDataFactory.threeUnitMatrix(), TestDataFactory.balancedTree(), null);

        assertThat(table.metrics()).containsExactly("richness", "PSV", "PSR", "PSC", "MPD", "MNTD", "PD");
        assertThat(table.rows()).hasSize(3);
        assertThat(table.rows().get(1).value("MPD")).isEqualTo(4.0);
        assertThat(table.rows().get(2).richness()).isEqualTo(1);
    }

    @Test
    void requestedSubsetKeepsRichnessFirst() {
        MetricTable table = service.runMetrics(
                TestDataFactory.threeUnitMatrix(), TestDataFactory.balancedTree(), List.of("PD", "MPD"));

        assertThat(table.metrics()).containsExactly("richness", "PD", "MPD");
        assertThat(table.column("PD")).containsExactly(3.0, 4.0, 2.0);
    }

    @Test
    void unknownMetricFails() {
        assertThatThrownBy(() -> service.runMetrics(
                        TestDataFactory.threeUnitMatrix(), TestDataFactory.balancedTree(), List.of("NRI")))
                .isInstanceOf(UnknownRegistryNameException.class);
    }

    @Test
    void speciesOutsideTreeFails() {
        CommunityDataMatrix cdm = CommunityDataMatrix.of(List.of("1"), List.of("a", "q"), new double[][] {{1, 1}});

        assertThatThrownBy(() -> service.runMetrics(cdm, TestDataFactory.balancedTree(), null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void metricReturningWrongLengthIsRejected() {
        Map<String, CommunityMetric> metrics = new LinkedHashMap<>();
        metrics.put("richness", input -> new double[input.unitCount()]);
        metrics.put("broken", input -> new double[1]);
        MetricsInput input = MetricsInput.prepare(TestDataFactory.threeUnitMatrix(), TestDataFactory.balancedTree());

        assertThatThrownBy(() -> service.runResolved(input, metrics))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("broken");
    }
}
