/* (C)2026 */
package com.ammann.metrictester.service;

import com.ammann.metrictester.exception.InfeasibleParametersException;
import com.ammann.metrictester.exception.PlacementRetriesExhaustedException;
import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.Arena;
import com.ammann.metrictester.model.CommunityDataMatrix;
import com.ammann.metrictester.model.QuadratBounds;
import com.ammann.metrictester.model.RegionalAbundance;
import com.ammann.metrictester.model.SampledCommunity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Places non-overlapping square quadrats in a square arena and turns the individuals they
 * enclose into a community data matrix.
 *
 * <p>Placement is rejection sampling over integer origins. Two guards keep it from running
 * forever: a density precondition checked before any sampling, and a per-quadrat attempt cap.
 */
@ApplicationScoped
public class QuadratPlacementService {

    private static final Logger LOG = Logger.getLogger(QuadratPlacementService.class);

    /** Largest expected fraction of the arena the quadrats may cover. */
    public static final double MAX_COVERED_FRACTION = 0.4;

    private final int maxAttempts;
    private final Optional<Long> seed;

    @Inject
    public QuadratPlacementService(
            @ConfigProperty(name = "metrictester.quadrat.max-attempts", defaultValue = "10000") int maxAttempts,
            @ConfigProperty(name = "metrictester.quadrat.seed") Optional<Long> seed) {
        if (maxAttempts <= 0) {
            throw ValidationException.invalidParameter("metrictester.quadrat.max-attempts", maxAttempts, "positive count");
        }
        this.maxAttempts = maxAttempts;
        this.seed = seed;
    }

    /**
     * Places quadrats using a fresh generator, seeded from configuration when a seed is set.
     *
     * @see #placeQuadrats(int, int, int, RandomGenerator)
     */
    public List<QuadratBounds> placeQuadrats(int count, int arenaLength, int quadratLength) {
        return placeQuadrats(count, arenaLength, quadratLength, newGenerator());
    }

    /**
     * Places {@code count} quadrats of side {@code quadratLength} in an arena of side
     * {@code arenaLength}.
     *
     * @param count number of quadrats
     * @param arenaLength side length of the arena
     * @param quadratLength side length of each quadrat
     * @param random source of origins
     * @return bounds in placement order; quadrat {@code i} has identity {@code i}
     * @throws InfeasibleParametersException if the quadrats would cover more than
     *     {@value #MAX_COVERED_FRACTION} of the arena
     * @throws PlacementRetriesExhaustedException if a quadrat finds no free spot within the
     *     configured attempts
     */
    public List<QuadratBounds> placeQuadrats(int count, int arenaLength, int quadratLength, RandomGenerator random) {
        if (count <= 0) {
            throw ValidationException.invalidParameter("count", count, "positive number of quadrats");
        }
        if (arenaLength <= 0) {
            throw ValidationException.invalidParameter("arenaLength", arenaLength, "positive length");
        }
        if (quadratLength <= 0) {
            throw ValidationException.invalidParameter("quadratLength", quadratLength, "positive length");
        }
        double covered = ((double) quadratLength * quadratLength) / ((double) arenaLength * arenaLength) * count;
        if (covered > MAX_COVERED_FRACTION) {
            throw InfeasibleParametersException.coverage(covered, MAX_COVERED_FRACTION);
        }

        int originRange = arenaLength - quadratLength + 1;
        List<QuadratBounds> placed = new ArrayList<>(count);
        long totalAttempts = 0;
        for (int quadrat = 1; quadrat <= count; quadrat++) {
            QuadratBounds accepted = null;
            int attempts = 0;
            while (accepted == null) {
                if (attempts == maxAttempts) {
                    throw new PlacementRetriesExhaustedException(quadrat, attempts);
                }
                attempts++;
                int x = random.nextInt(originRange);
                int y = random.nextInt(originRange);
                QuadratBounds candidate = new QuadratBounds(quadrat, x, x + quadratLength, y, y + quadratLength);
                if (placed.stream().noneMatch(candidate::overlaps)) {
                    accepted = candidate;
                }
            }
            totalAttempts += attempts;
            placed.add(accepted);
        }

        LOG.debugf("Placed %d quadrats of side %d in arena of side %d (%d candidates drawn)",
                count, quadratLength, arenaLength, totalAttempts);
        return List.copyOf(placed);
    }

    /**
     * Places quadrats in a simulated arena and builds the community data matrix of their
     * contents. The arena's regional abundance travels with the matrix; without one it is
     * derived from the matrix.
     *
     * @param arena simulated arena
     * @param count number of quadrats
     * @param quadratLength side length of each quadrat
     * @return the sampled matrix, its regional abundance and the quadrat bounds
     */
    public SampledCommunity sampleArena(Arena arena, int count, int quadratLength) {
        if (arena == null) {
            throw new ValidationException("Arena sampling requires an arena");
        }
        List<QuadratBounds> bounds = placeQuadrats(count, arena.length(), quadratLength);
        CommunityDataMatrix cdm = quadratContents(arena, bounds);
        RegionalAbundance regional = arena.regionalAbundance();
        if (regional == null) {
            LOG.debug("Arena carries no regional abundance, deriving it from the sampled matrix");
            regional = RegionalAbundance.fromCommunity(cdm);
        }
        LOG.infof("Sampled arena %dx%d with %d quadrats: %s",
                arena.width(), arena.height(), bounds.size(), cdm);
        return new SampledCommunity(cdm, regional, bounds);
    }

    /**
     * Counts the individuals of each species inside each quadrat. Rows are quadrats in bounds
     * order with ids {@code "1".."K"}, columns are all arena species, sorted.
     */
    public CommunityDataMatrix quadratContents(Arena arena, List<QuadratBounds> bounds) {
        List<String> species = arena.species();
        if (species.isEmpty()) {
            throw ValidationException.insufficientData("arena individuals", 1, 0);
        }
        double[][] counts = new double[bounds.size()][species.size()];
        List<String> unitIds = new ArrayList<>(bounds.size());
        for (int row = 0; row < bounds.size(); row++) {
            QuadratBounds quadrat = bounds.get(row);
            unitIds.add(quadrat.unitId());
            for (Arena.Individual individual : arena.individuals()) {
                if (quadrat.contains(individual.x(), individual.y())) {
                    counts[row][species.indexOf(individual.species())]++;
                }
            }
        }
        return CommunityDataMatrix.of(unitIds, species, counts);
    }

    private RandomGenerator newGenerator() {
        return seed.<RandomGenerator>map(Well19937c::new).orElseGet(Well19937c::new);
    }
}
