/* (C)2026 */
package com.ammann.metrictester.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metrics of every unit of one community data matrix, one row per unit in matrix row order.
 * The {@value #RICHNESS} column is always present and always first.
 */
public record MetricTable(List<String> metrics, List<MetricRow> rows) {

    /** Name of the canonical richness metric. */
    public static final String RICHNESS = "richness";

    /** Name of the unit identity column in tabular output. */
    public static final String QUADRAT = "quadrat";

    public MetricTable {
        metrics = List.copyOf(metrics);
        rows = List.copyOf(rows);
        if (metrics.isEmpty() || !RICHNESS.equals(metrics.get(0))) {
            throw new IllegalArgumentException("Metric table must start with the richness column: " + metrics);
        }
        for (MetricRow row : rows) {
            if (!row.values().keySet().containsAll(metrics)) {
                throw new IllegalArgumentException("Row " + row.unitId() + " lacks columns of " + metrics);
            }
        }
    }

    /** Values of one metric, in row order. */
    public double[] column(String metric) {
        double[] values = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            values[i] = rows.get(i).value(metric);
        }
        return values;
    }

    /** Every metric column keyed by name, in metric order. */
    public Map<String, double[]> columns() {
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (String metric : metrics) {
            columns.put(metric, column(metric));
        }
        return columns;
    }
}
