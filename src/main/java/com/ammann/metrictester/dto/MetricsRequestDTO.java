/* (C)2026 */
package com.ammann.metrictester.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Request to calculate observed metrics")
public record MetricsRequestDTO(
        @Schema(description = "Phylogeny in Newick format", example = "((a:1,b:1):1,c:2);") String newick,
        @Schema(description = "Community data matrix") CommunityMatrixDTO cdm,
        @Schema(description = "Metric names; all metrics when omitted") List<String> metrics) {}
