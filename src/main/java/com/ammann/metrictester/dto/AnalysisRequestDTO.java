/* (C)2026 */
package com.ammann.metrictester.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request for a complete randomization analysis of one community.
 *
 * @param newick phylogeny covering the matrix and the regional pool
 * @param cdm observed community data matrix
 * @param regionalAbundance optional species pool, one label per individual
 * @param metrics metric names, all when omitted
 * @param nulls null model names, all when omitted
 * @param groupBy {@code richness} (default) or {@code quadrat}
 * @param alternative {@code two.sided} (default), {@code greater} or {@code less}
 */
@Schema(description = "Randomization analysis request")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisRequestDTO(
        @Schema(description = "Phylogeny in Newick format") String newick,
        @Schema(description = "Observed community data matrix") CommunityMatrixDTO cdm,
        @Schema(description = "Regional abundance, one species label per individual") List<String> regionalAbundance,
        @Schema(description = "Metric names; all metrics when omitted") List<String> metrics,
        @Schema(description = "Null model names; all null models when omitted") List<String> nulls,
        @Schema(description = "Grouping of replicates", enumeration = {"richness", "quadrat"}) String groupBy,
        @Schema(description = "Alternative hypothesis of the robust test", enumeration = {"two.sided", "greater", "less"})
        String alternative) {}
