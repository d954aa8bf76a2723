/* (C)2026 */
package com.ammann.metrictester.nulls;

import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.CommunityDataMatrix;
import com.ammann.metrictester.model.NullsInput;
import com.ammann.metrictester.model.RegionalAbundance;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.apache.commons.math3.random.RandomGenerator;
import org.jboss.logging.Logger;

/**
 * Built-in null models. Every factory takes the number of randomized matrices one invocation
 * produces.
 */
public final class NullModels {

    private static final Logger LOG = Logger.getLogger(NullModels.class);

    // Upper bound on swap attempts per requested successful swap
    private static final int SWAP_ATTEMPTS_PER_SWAP = 100;

    private NullModels() {}

    /** Shuffles abundances within each unit; keeps every unit's richness and abundance values. */
    public static NullModel richness(int replicates) {
        requirePositive("replicates", replicates);
        return (input, random) -> replicate(replicates, () -> {
            double[][] cells = input.cdm().toArray();
            for (double[] row : cells) {
                shuffle(row, random);
            }
            return input.cdm().withAbundances(cells);
        });
    }

    /** Shuffles abundances within each species column; keeps every species' occurrence frequency. */
    public static NullModel frequency(int replicates) {
        requirePositive("replicates", replicates);
        return (input, random) -> replicate(replicates, () -> {
            double[][] cells = input.cdm().toArray();
            int units = cells.length;
            for (int column = 0; column < input.cdm().speciesCount(); column++) {
                for (int i = units - 1; i > 0; i--) {
                    int j = random.nextInt(i + 1);
                    double swap = cells[i][column];
                    cells[i][column] = cells[j][column];
                    cells[j][column] = swap;
                }
            }
            return input.cdm().withAbundances(cells);
        });
    }

    /**
     * Shuffles species labels across columns, which is equivalent to shuffling the tips of the
     * tree while keeping the matrix intact.
     */
    public static NullModel taxaLabels(int replicates) {
        requirePositive("replicates", replicates);
        return (input, random) -> replicate(replicates, () -> {
            List<String> labels = new ArrayList<>(input.cdm().species());
            for (int i = labels.size() - 1; i > 0; i--) {
                int j = random.nextInt(i + 1);
                labels.set(i, labels.set(j, labels.get(i)));
            }
            return input.cdm().withSpecies(labels);
        });
    }

    /**
     * Independent swap: repeatedly picks two units and two species forming a checkerboard
     * (each unit holds exactly one of the two species) and swaps them, which keeps both the
     * richness of every unit and the frequency of every species.
     *
     * @param replicates matrices per invocation
     * @param swaps successful swaps per matrix
     */
    public static NullModel independentSwap(int replicates, int swaps) {
        requirePositive("replicates", replicates);
        requirePositive("swaps", swaps);
        return (input, random) -> replicate(replicates, () -> swap(input.cdm(), swaps, random));
    }

    private static CommunityDataMatrix swap(CommunityDataMatrix cdm, int swaps, RandomGenerator random) {
        double[][] cells = cdm.toArray();
        int units = cdm.unitCount();
        int species = cdm.speciesCount();
        if (units < 2 || species < 2) {
            return cdm;
        }
        long maxAttempts = (long) swaps * SWAP_ATTEMPTS_PER_SWAP;
        int done = 0;
        long attempts = 0;
        while (done < swaps && attempts < maxAttempts) {
            attempts++;
            int r1 = random.nextInt(units);
            int r2 = random.nextInt(units - 1);
            if (r2 >= r1) r2++;
            int c1 = random.nextInt(species);
            int c2 = random.nextInt(species - 1);
            if (c2 >= c1) c2++;
            if (cells[r1][c1] > 0 && cells[r2][c2] > 0 && cells[r1][c2] == 0 && cells[r2][c1] == 0) {
                cells[r1][c2] = cells[r1][c1];
                cells[r1][c1] = 0;
                cells[r2][c1] = cells[r2][c2];
                cells[r2][c2] = 0;
                done++;
            }
        }
        if (done < swaps) {
            LOG.debugf("Independent swap stopped after %d of %d swaps (%d attempts)", done, swaps, attempts);
        }
        return cdm.withAbundances(cells);
    }

    /**
     * Redraws the species of every unit from the regional pool, weighted by regional abundance,
     * keeping each unit's richness and shuffling its abundance values onto the drawn species.
     * Pool species absent from the observed matrix become additional columns.
     */
    public static NullModel regional(int replicates) {
        requirePositive("replicates", replicates);
        return (input, random) -> {
            List<String> columns = poolColumns(input);
            return replicate(replicates, () -> redraw(input, columns, random));
        };
    }

    private static List<String> poolColumns(NullsInput input) {
        List<String> columns = new ArrayList<>(input.cdm().species());
        for (String species : input.regionalAbundance().species()) {
            if (input.cdm().columnOf(species) < 0) {
                columns.add(species);
            }
        }
        return columns;
    }

    private static CommunityDataMatrix redraw(NullsInput input, List<String> columns, RandomGenerator random) {
        CommunityDataMatrix cdm = input.cdm();
        RegionalAbundance pool = input.regionalAbundance();
        double[][] cells = new double[cdm.unitCount()][columns.size()];
        for (int row = 0; row < cdm.unitCount(); row++) {
            int[] present = cdm.presentColumns(row);
            double[] abundances = new double[present.length];
            for (int i = 0; i < present.length; i++) {
                abundances[i] = cdm.abundance(row, present[i]);
            }
            shuffle(abundances, random);
            List<String> drawn = pool.drawDistinct(present.length, random);
            for (int i = 0; i < drawn.size(); i++) {
                cells[row][columns.indexOf(drawn.get(i))] = abundances[i];
            }
        }
        return CommunityDataMatrix.of(cdm.unitIds(), columns, cells);
    }

    private static List<CommunityDataMatrix> replicate(int replicates, Supplier<CommunityDataMatrix> randomization) {
        List<CommunityDataMatrix> matrices = new ArrayList<>(replicates);
        for (int i = 0; i < replicates; i++) {
            matrices.add(randomization.get());
        }
        return matrices;
    }

    private static void shuffle(double[] values, RandomGenerator random) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            double swap = values[i];
            values[i] = values[j];
            values[j] = swap;
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw ValidationException.invalidParameter(name, value, "positive count");
        }
    }
}
