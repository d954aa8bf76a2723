/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.MetricRow;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Metrics of one unit. Undefined values (NaN) are sent as {@code null}.
 */
@Schema(description = "Metric values of one unit")
public record MetricRowDTO(
        @Schema(description = "Unit identifier") String quadrat,
        @Schema(description = "Species richness") Integer richness,
        @Schema(description = "Metric values by name, null where undefined") Map<String, Double> values) {

    public static MetricRowDTO from(MetricRow row) {
        return new MetricRowDTO(row.unitId(), row.richness(), finiteValues(row.values()));
    }

    static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    static Map<String, Double> finiteValues(Map<String, Double> values) {
        Map<String, Double> converted = new LinkedHashMap<>();
        values.forEach((name, value) -> converted.put(name, value == null ? null : finiteOrNull(value)));
        return converted;
    }
}
