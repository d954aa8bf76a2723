/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.RobustTestResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "One-sample Wilcoxon signed-rank test of one column against zero")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RobustTestResultDTO(
        @Schema(description = "Mean of the finite values") Double estimate,
        @Schema(description = "p-value, absent when undefined") Double pValue,
        @Schema(description = "Non-zero values entering the test") Integer n,
        @Schema(description = "Signed-rank statistic V") Double statistic,
        @Schema(description = "Method used for the p-value", example = "exact") String method) {

    public static RobustTestResultDTO from(RobustTestResult result) {
        return new RobustTestResultDTO(
                MetricRowDTO.finiteOrNull(result.estimate()),
                MetricRowDTO.finiteOrNull(result.pValue()),
                result.n(),
                result.statistic(),
                result.exact() ? "exact" : "normal approximation");
    }
}
