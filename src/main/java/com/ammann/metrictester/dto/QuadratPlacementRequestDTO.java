/* (C)2026 */
package com.ammann.metrictester.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request to place non-overlapping square quadrats in a square arena.
 */
@Schema(description = "Quadrat placement request")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuadratPlacementRequestDTO(
        @Schema(description = "Number of quadrats to place", example = "10")
        Integer count,

        @Schema(description = "Side length of the arena", example = "300")
        Integer arenaLength,

        @Schema(description = "Side length of each quadrat", example = "30")
        Integer quadratLength
) {}
