/* (C)2026 */
package com.ammann.metrictester.model;

import java.util.List;

/**
 * CDM built from quadrats placed in an arena, together with the regional abundance that
 * accompanies it into the randomization step.
 */
public record SampledCommunity(
        CommunityDataMatrix cdm, RegionalAbundance regionalAbundance, List<QuadratBounds> bounds) {

    public SampledCommunity {
        bounds = List.copyOf(bounds);
    }
}
