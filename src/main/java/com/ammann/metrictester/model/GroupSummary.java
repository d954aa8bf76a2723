/* (C)2026 */
package com.ammann.metrictester.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary row for one grouping key (a richness level or a quadrat id).
 */
public record GroupSummary(String key, Map<String, MetricSummary> metrics) {

    public GroupSummary {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public MetricSummary metric(String metric) {
        MetricSummary summary = metrics.get(metric);
        if (summary == null) {
            throw new IllegalArgumentException("No summary for metric '" + metric + "' in group " + key);
        }
        return summary;
    }
}
