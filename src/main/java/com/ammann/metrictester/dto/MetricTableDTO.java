/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.MetricTable;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Metric table, one row per unit, richness first")
public record MetricTableDTO(
        @Schema(description = "Metric columns in order") List<String> metrics,
        @Schema(description = "Rows in unit order") List<MetricRowDTO> rows) {

    public static MetricTableDTO from(MetricTable table) {
        return new MetricTableDTO(table.metrics(), table.rows().stream().map(MetricRowDTO::from).toList());
    }
}
