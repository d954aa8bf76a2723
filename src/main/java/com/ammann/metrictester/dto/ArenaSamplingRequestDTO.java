/* (C)2026 */
package com.ammann.metrictester.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Request to sample a simulated arena with quadrats")
public record ArenaSamplingRequestDTO(
        @Schema(description = "Arena to sample") ArenaDTO arena,
        @Schema(description = "Number of quadrats", example = "10") Integer quadratCount,
        @Schema(description = "Side length of each quadrat", example = "30") Integer quadratLength) {}
