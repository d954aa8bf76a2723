/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.MetricSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Null distribution of one metric within one group")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricSummaryDTO(
        @Schema(description = "Number of finite replicate values") Long count,
        @Schema(description = "Mean") Double mean,
        @Schema(description = "Standard deviation") Double sd,
        @Schema(description = "Lower confidence bound") Double lower,
        @Schema(description = "Upper confidence bound") Double upper) {

    public static MetricSummaryDTO from(MetricSummary summary) {
        return new MetricSummaryDTO(
                summary.count(),
                MetricRowDTO.finiteOrNull(summary.mean()),
                MetricRowDTO.finiteOrNull(summary.sd()),
                MetricRowDTO.finiteOrNull(summary.lower()),
                MetricRowDTO.finiteOrNull(summary.upper()));
    }
}
