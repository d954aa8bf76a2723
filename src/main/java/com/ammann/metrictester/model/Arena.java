/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.exception.ValidationException;
import java.util.List;
import java.util.TreeSet;

/**
 * Result of a spatial simulation: individuals with species identity and coordinates inside a
 * rectangular arena, plus the regional abundance the simulation drew from, if it recorded one.
 *
 * @param width arena extent along X
 * @param height arena extent along Y
 * @param individuals simulated individuals
 * @param regionalAbundance source pool of the simulation, {@code null} if not recorded
 */
public record Arena(int width, int height, List<Individual> individuals, RegionalAbundance regionalAbundance) {

    public Arena {
        if (width <= 0 || height <= 0) {
            throw ValidationException.invalidParameter("arena dimensions", width + "x" + height, "positive sizes");
        }
        individuals = individuals == null ? List.of() : List.copyOf(individuals);
    }

    /** Side length used for quadrat placement, the larger of the two dimensions. */
    public int length() {
        return Math.max(width, height);
    }

    /** All species occurring in the arena, sorted. */
    public List<String> species() {
        TreeSet<String> species = new TreeSet<>();
        for (Individual individual : individuals) {
            species.add(individual.species());
        }
        return List.copyOf(species);
    }

    /**
     * A single simulated individual.
     */
    public record Individual(String species, double x, double y) {

        public Individual {
            if (species == null || species.isBlank()) {
                throw ValidationException.invalidParameter("individual species", species, "species label");
            }
        }
    }
}
