/* (C)2026 */
package com.ammann.metrictester.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Names registered in a catalogue, in catalogue order")
public record CatalogueDTO(
        @Schema(description = "Catalogue name", example = "metrics") String registry,
        @Schema(description = "Registered names") List<String> names) {}
