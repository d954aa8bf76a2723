/* (C)2026 */
package com.ammann.metrictester.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Named columns to test against a location of zero. {@code null} entries are treated as
 * missing values.
 */
@Schema(description = "Signed-rank test request")
public record RobustTestRequestDTO(
        @Schema(description = "Values by column name") Map<String, List<Double>> columns,
        @Schema(description = "Alternative hypothesis", enumeration = {"two.sided", "greater", "less"})
        String alternative) {

    public Map<String, double[]> toColumns() {
        Map<String, double[]> converted = new LinkedHashMap<>();
        if (columns == null) {
            return converted;
        }
        columns.forEach((name, values) -> converted.put(name, values == null
                ? null
                : values.stream().mapToDouble(value -> value == null ? Double.NaN : value).toArray()));
        return converted;
    }
}
