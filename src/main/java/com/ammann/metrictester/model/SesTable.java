/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.enumeration.GroupingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Standardized effect sizes of the observed metrics, one row per observed unit.
 */
public record SesTable(String nullModel, GroupingMode mode, List<String> metrics, List<ScoreRow> rows) {

    public SesTable {
        metrics = List.copyOf(metrics);
        rows = List.copyOf(rows);
    }

    public double[] column(String metric) {
        double[] values = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            values[i] = rows.get(i).scores().get(metric);
        }
        return values;
    }

    public Map<String, double[]> columns() {
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (String metric : metrics) {
            columns.put(metric, column(metric));
        }
        return columns;
    }

    /**
     * @param unitId observed unit
     * @param groupKey grouping key the unit was compared under
     * @param scores SES per metric
     */
    public record ScoreRow(String unitId, String groupKey, Map<String, Double> scores) {

        public ScoreRow {
            scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        }
    }
}
