/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.Arena;
import com.ammann.metrictester.model.RegionalAbundance;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Simulated arena as submitted by clients.
 *
 * @param width arena extent along X
 * @param height arena extent along Y
 * @param individuals individuals with positions
 * @param regionalAbundance optional species pool, one label per individual
 */
@Schema(description = "Simulated arena with positioned individuals")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArenaDTO(
        @Schema(description = "Arena extent along X", example = "300") Integer width,
        @Schema(description = "Arena extent along Y", example = "300") Integer height,
        @Schema(description = "Positioned individuals") List<IndividualDTO> individuals,
        @Schema(description = "Regional abundance, one species label per individual")
        List<String> regionalAbundance) {

    public Arena toArena() {
        if (width == null || height == null) {
            throw ValidationException.invalidParameter("arena dimensions", width + "x" + height, "positive sizes");
        }
        List<Arena.Individual> converted = new ArrayList<>();
        if (individuals != null) {
            for (IndividualDTO individual : individuals) {
                if (individual == null || individual.x() == null || individual.y() == null) {
                    throw ValidationException.invalidParameter("individual", individual, "species with x and y");
                }
                converted.add(new Arena.Individual(individual.species(), individual.x(), individual.y()));
            }
        }
        RegionalAbundance pool = regionalAbundance == null || regionalAbundance.isEmpty()
                ? null
                : RegionalAbundance.ofIndividuals(regionalAbundance);
        return new Arena(width, height, converted, pool);
    }
}
