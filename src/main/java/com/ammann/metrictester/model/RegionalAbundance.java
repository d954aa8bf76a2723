/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Species pool from which local communities are assumed to be drawn, held as a multiset of
 * species identifiers ("s1, s1, s1, s2, s2, s3").
 */
public final class RegionalAbundance {

    private final Map<String, Long> counts;
    private final long total;

    private RegionalAbundance(Map<String, Long> counts) {
        this.counts = Collections.unmodifiableMap(counts);
        this.total = counts.values().stream().mapToLong(Long::longValue).sum();
    }

    /**
     * Builds the pool from one identifier per individual.
     *
     * @param individuals species identifiers, repeated once per individual
     */
    public static RegionalAbundance ofIndividuals(List<String> individuals) {
        if (individuals == null || individuals.isEmpty()) {
            throw ValidationException.insufficientData("regional abundance individuals", 1, 0);
        }
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String species : individuals) {
            if (species == null || species.isBlank()) {
                throw ValidationException.invalidParameter("regional abundance", species, "species label");
            }
            counts.merge(species, 1L, Long::sum);
        }
        return new RegionalAbundance(counts);
    }

    /**
     * Derives the pool from the column totals of a community data matrix. Fractional
     * abundances are rounded to whole individuals; species that never occur are left out.
     */
    public static RegionalAbundance fromCommunity(CommunityDataMatrix cdm) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (int column = 0; column < cdm.speciesCount(); column++) {
            long individuals = Math.round(cdm.columnTotal(column));
            if (individuals > 0) {
                counts.put(cdm.species().get(column), individuals);
            }
        }
        if (counts.isEmpty()) {
            throw ValidationException.insufficientData("occupied cells to derive regional abundance", 1, 0);
        }
        return new RegionalAbundance(counts);
    }

    public Set<String> species() {
        return counts.keySet();
    }

    public long count(String species) {
        return counts.getOrDefault(species, 0L);
    }

    public long total() {
        return total;
    }

    /** The pool expanded back into one identifier per individual. */
    public List<String> toIndividuals() {
        List<String> individuals = new ArrayList<>();
        counts.forEach((species, count) -> {
            for (long i = 0; i < count; i++) {
                individuals.add(species);
            }
        });
        return individuals;
    }

    /**
     * Draws {@code k} distinct species, each draw picking a species with probability
     * proportional to its abundance among the species not drawn yet.
     *
     * @throws ValidationException if the pool holds fewer than {@code k} species
     */
    public List<String> drawDistinct(int k, RandomGenerator random) {
        if (k > counts.size()) {
            throw ValidationException.insufficientData("species in regional pool", k, counts.size());
        }
        List<String> remaining = new ArrayList<>(counts.keySet());
        long remainingTotal = total;
        List<String> drawn = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            double target = random.nextDouble() * remainingTotal;
            int chosen = remaining.size() - 1;
            double cumulative = 0.0;
            for (int j = 0; j < remaining.size(); j++) {
                cumulative += counts.get(remaining.get(j));
                if (target < cumulative) {
                    chosen = j;
                    break;
                }
            }
            String species = remaining.remove(chosen);
            remainingTotal -= counts.get(species);
            drawn.add(species);
        }
        return drawn;
    }
}
