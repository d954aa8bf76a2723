/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.AnalysisResult;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Observed metrics and per null model results")
public record AnalysisResponseDTO(
        @Schema(description = "Observed metric table") MetricTableDTO observed,
        @Schema(description = "Grouping used for the comparison") String groupBy,
        @Schema(description = "Alternative hypothesis of the robust test") String alternative,
        @Schema(description = "Results by null model name") Map<String, NullModelResultDTO> nulls) {

    public static AnalysisResponseDTO from(AnalysisResult result) {
        Map<String, NullModelResultDTO> nulls = new LinkedHashMap<>();
        result.nulls().forEach((name, nullResult) -> nulls.put(name, NullModelResultDTO.from(nullResult)));
        return new AnalysisResponseDTO(
                MetricTableDTO.from(result.observed()),
                result.mode().getColumn(),
                result.alternative().name(),
                nulls);
    }
}
