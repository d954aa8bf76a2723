/* (C)2026 */
package com.ammann.metrictester.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Simulated individual with species identity and position")
public record IndividualDTO(
        @Schema(description = "Species label", example = "s1") String species,
        @Schema(description = "X coordinate") Double x,
        @Schema(description = "Y coordinate") Double y) {}
