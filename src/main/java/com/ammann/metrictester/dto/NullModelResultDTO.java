/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.NullModelResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Results of one null model")
public record NullModelResultDTO(
        @Schema(description = "Number of randomized matrices") Integer replicates,
        @Schema(description = "Null distributions per grouping key") List<GroupSummaryDTO> summary,
        @Schema(description = "Standardized effect sizes per observed unit") List<ScoreRowDTO> ses,
        @Schema(description = "Significance codes per observed unit") List<SignificanceRowDTO> significance,
        @Schema(description = "Signed-rank test per SES column") Map<String, RobustTestResultDTO> robust) {

    public static NullModelResultDTO from(NullModelResult result) {
        Map<String, RobustTestResultDTO> robust = new LinkedHashMap<>();
        result.robust().forEach((metric, test) -> robust.put(metric, RobustTestResultDTO.from(test)));
        return new NullModelResultDTO(
                result.replicates().replicateCount(),
                result.summary().groups().values().stream().map(GroupSummaryDTO::from).toList(),
                result.ses().rows().stream().map(ScoreRowDTO::from).toList(),
                result.significance().rows().stream().map(SignificanceRowDTO::from).toList(),
                robust);
    }
}
