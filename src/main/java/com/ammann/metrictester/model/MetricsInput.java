/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.exception.ValidationException;
import java.util.Arrays;
import java.util.List;

/**
 * Prepared context shared by all metrics evaluated on one community data matrix.
 *
 * <p>{@link #prepare} is the only way to obtain an instance. It checks that the tree covers
 * the matrix's species, prunes the tree to the matrix's species columns, and precomputes the
 * phylogenetic correlation and cophenetic distance matrices over them. A column stays in the
 * pruned tree when it holds no individuals, so a unit's metrics depend only on its own row.
 */
public final class MetricsInput {

    private static final double[][] EMPTY = new double[0][0];

    private final CommunityDataMatrix cdm;
    private final PhylogeneticTree tree;
    private final List<String> tipOrder;
    private final int[] columnToTip;
    private final double[][] correlation;
    private final double[][] distances;

    private MetricsInput(
            CommunityDataMatrix cdm,
            PhylogeneticTree tree,
            List<String> tipOrder,
            double[][] correlation,
            double[][] distances) {
        this.cdm = cdm;
        this.tree = tree;
        this.tipOrder = tipOrder;
        this.correlation = correlation;
        this.distances = distances;
        this.columnToTip = new int[cdm.speciesCount()];
        Arrays.fill(columnToTip, -1);
        for (int tip = 0; tip < tipOrder.size(); tip++) {
            columnToTip[cdm.columnOf(tipOrder.get(tip))] = tip;
        }
    }

    /**
     * Prepares the metric context for one matrix.
     *
     * @param cdm community data matrix, observed or randomized
     * @param tree phylogeny whose tips include every species column of {@code cdm}
     * @return the prepared context
     * @throws ValidationException if an argument is missing or a species is not in the tree
     */
    public static MetricsInput prepare(CommunityDataMatrix cdm, PhylogeneticTree tree) {
        if (cdm == null || tree == null) {
            throw new ValidationException("Metric calculation requires a community data matrix and a tree");
        }
        requireCovered(cdm, tree);
        List<String> species = List.copyOf(cdm.species());
        if (species.isEmpty()) {
            return new MetricsInput(cdm, null, species, EMPTY, EMPTY);
        }
        PhylogeneticTree pruned = tree.prune(species);
        return new MetricsInput(
                cdm,
                pruned,
                species,
                pruned.correlationMatrix(species),
                pruned.copheneticDistances(species));
    }

    static void requireCovered(CommunityDataMatrix cdm, PhylogeneticTree tree) {
        List<String> missing = cdm.species().stream().filter(s -> !tree.containsTip(s)).toList();
        if (!missing.isEmpty()) {
            throw new ValidationException(String.format(
                    "%d species of the community data matrix are not tips of the tree: %s",
                    missing.size(), missing.size() > 10 ? missing.subList(0, 10) + "..." : missing));
        }
    }

    public CommunityDataMatrix cdm() {
        return cdm;
    }

    /** Tree pruned to the species columns, {@code null} when the matrix has no columns. */
    public PhylogeneticTree tree() {
        return tree;
    }

    public int unitCount() {
        return cdm.unitCount();
    }

    /** Indices into {@link #correlation} and {@link #distance} of the species present in a unit. */
    public int[] presentTips(int row) {
        int[] columns = cdm.presentColumns(row);
        int[] tips = new int[columns.length];
        for (int i = 0; i < columns.length; i++) {
            tips[i] = columnToTip[columns[i]];
        }
        return tips;
    }

    public double correlation(int tipA, int tipB) {
        return correlation[tipA][tipB];
    }

    public double distance(int tipA, int tipB) {
        return distances[tipA][tipB];
    }

    public String tipLabel(int tip) {
        return tipOrder.get(tip);
    }
}
