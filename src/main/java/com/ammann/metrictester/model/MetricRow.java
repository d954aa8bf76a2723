/* (C)2026 */
package com.ammann.metrictester.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metric values of one sampling unit, in metric order, tagged with the unit's identity and
 * species richness. A NaN value marks a metric that is undefined for the unit.
 */
public record MetricRow(String unitId, int richness, Map<String, Double> values) {

    public MetricRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @throws IllegalArgumentException if the row has no value for the metric
     */
    public double value(String metric) {
        Double value = values.get(metric);
        if (value == null) {
            throw new IllegalArgumentException("No value for metric '" + metric + "' in unit " + unitId);
        }
        return value;
    }
}
