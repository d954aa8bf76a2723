/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.QuadratBounds;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Inclusive bounds of one placed quadrat")
public record QuadratBoundsDTO(
        @Schema(description = "Quadrat identity, its 1-based placement order") int quadrat,
        @Schema(description = "Left edge") int xMin,
        @Schema(description = "Right edge") int xMax,
        @Schema(description = "Bottom edge") int yMin,
        @Schema(description = "Top edge") int yMax) {

    public static QuadratBoundsDTO from(QuadratBounds bounds) {
        return new QuadratBoundsDTO(bounds.quadrat(), bounds.xMin(), bounds.xMax(), bounds.yMin(), bounds.yMax());
    }
}
