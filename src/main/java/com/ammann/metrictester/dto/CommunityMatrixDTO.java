/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.CommunityDataMatrix;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Community data matrix in wire form: unit ids, species labels and a row-major abundance grid.
 */
@Schema(description = "Community data matrix (units x species abundances)")
public record CommunityMatrixDTO(
        @Schema(description = "Unit (quadrat) identifiers, one per row") List<String> units,
        @Schema(description = "Species labels, one per column") List<String> species,
        @Schema(description = "Abundances, one array per unit in species order") double[][] abundances) {

    public CommunityDataMatrix toMatrix() {
        return CommunityDataMatrix.of(units, species, abundances);
    }

    public static CommunityMatrixDTO from(CommunityDataMatrix cdm) {
        return new CommunityMatrixDTO(cdm.unitIds(), cdm.species(), cdm.toArray());
    }
}
