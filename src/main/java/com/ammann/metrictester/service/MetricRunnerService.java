/* (C)2026 */
package com.ammann.metrictester.service;

import com.ammann.metrictester.metric.CommunityMetric;
import com.ammann.metrictester.model.CommunityDataMatrix;
import com.ammann.metrictester.model.MetricRow;
import com.ammann.metrictester.model.MetricTable;
import com.ammann.metrictester.model.MetricsInput;
import com.ammann.metrictester.model.PhylogeneticTree;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Applies a selection of registered metrics to one community data matrix.
 *
 * <p>Used for the observed matrix and for every randomized replicate alike. The service holds
 * no per-call state and is safe to call from concurrent randomization workers.
 */
@ApplicationScoped
public class MetricRunnerService {

    private static final Logger LOG = Logger.getLogger(MetricRunnerService.class);

    private final MetricRegistry metricRegistry;

    @Inject
    public MetricRunnerService(MetricRegistry metricRegistry) {
        this.metricRegistry = metricRegistry;
    }

    /**
     * Calculates the observed metrics of a matrix.
     *
     * @param cdm community data matrix
     * @param tree phylogeny covering the matrix's species
     * @param metricNames metric subset, {@code null} or empty for all metrics
     * @return one row per unit, richness first
     */
    public MetricTable runMetrics(CommunityDataMatrix cdm, PhylogeneticTree tree, Collection<String> metricNames) {
        return runMetrics(MetricsInput.prepare(cdm, tree), metricNames);
    }

    /**
     * Calculates metrics on an already prepared context.
     */
    public MetricTable runMetrics(MetricsInput input, Collection<String> metricNames) {
        return runResolved(input, metricRegistry.select(metricNames));
    }

    /**
     * Calculates already resolved metrics. Every metric must return one value per unit.
     *
     * @throws IllegalStateException if a metric returns the wrong number of values
     */
    public MetricTable runResolved(MetricsInput input, Map<String, CommunityMetric> metrics) {
        int units = input.unitCount();
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (Map.Entry<String, CommunityMetric> entry : metrics.entrySet()) {
            double[] values = entry.getValue().calculate(input);
            if (values == null || values.length != units) {
                throw new IllegalStateException(String.format(
                        "Metric '%s' returned %s values for %d units",
                        entry.getKey(), values == null ? "no" : Integer.toString(values.length), units));
            }
            columns.put(entry.getKey(), values);
        }

        List<MetricRow> rows = new ArrayList<>(units);
        CommunityDataMatrix cdm = input.cdm();
        for (int row = 0; row < units; row++) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (Map.Entry<String, double[]> column : columns.entrySet()) {
                values.put(column.getKey(), column.getValue()[row]);
            }
            rows.add(new MetricRow(cdm.unitId(row), cdm.richness(row), values));
        }

        LOG.debugf("Calculated %d metrics for %d units", columns.size(), units);
        return new MetricTable(List.copyOf(columns.keySet()), rows);
    }
}
