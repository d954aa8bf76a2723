/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.SampledCommunity;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Community sampled from an arena")
public record SampledCommunityDTO(
        @Schema(description = "Sampled community data matrix") CommunityMatrixDTO cdm,
        @Schema(description = "Regional abundance as individuals per species") Map<String, Long> regionalAbundance,
        @Schema(description = "Placed quadrats") List<QuadratBoundsDTO> quadrats) {

    public static SampledCommunityDTO from(SampledCommunity sampled) {
        Map<String, Long> pool = new LinkedHashMap<>();
        for (String species : sampled.regionalAbundance().species()) {
            pool.put(species, sampled.regionalAbundance().count(species));
        }
        return new SampledCommunityDTO(
                CommunityMatrixDTO.from(sampled.cdm()),
                pool,
                sampled.bounds().stream().map(QuadratBoundsDTO::from).toList());
    }
}
