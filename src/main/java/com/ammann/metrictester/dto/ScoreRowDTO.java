/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.SesTable.ScoreRow;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Standardized effect sizes of one observed unit")
public record ScoreRowDTO(
        @Schema(description = "Unit identifier") String quadrat,
        @Schema(description = "Grouping key the unit was compared under") String group,
        @Schema(description = "SES per metric, null where undefined") Map<String, Double> scores) {

    public static ScoreRowDTO from(ScoreRow row) {
        return new ScoreRowDTO(row.unitId(), row.groupKey(), MetricRowDTO.finiteValues(row.scores()));
    }
}
