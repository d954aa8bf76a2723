/* (C)2026 */
package com.ammann.metrictester.metric;

import com.ammann.metrictester.model.MetricsInput;

/**
 * Built-in community-structure metrics.
 *
 * <p>All tree-aware metrics read the correlation and cophenetic matrices that
 * {@link MetricsInput} computed on the tree pruned to the matrix's species columns. Metrics
 * that compare species pairs are NaN for units with fewer than two species.
 */
public final class PhylogeneticMetrics {

    private PhylogeneticMetrics() {}

    /** Number of species present in each unit. */
    public static double[] richness(MetricsInput input) {
        double[] values = new double[input.unitCount()];
        for (int row = 0; row < values.length; row++) {
            values[row] = input.cdm().richness(row);
        }
        return values;
    }

    /**
     * Phylogenetic species variability (Helmus et al. 2007) on presence/absence:
     * {@code (n * trace(C) - sum(C)) / (n * (n - 1))} over the correlation submatrix of the
     * present species.
     */
    public static double[] psv(MetricsInput input) {
        double[] values = new double[input.unitCount()];
        for (int row = 0; row < values.length; row++) {
            values[row] = psv(input, input.presentTips(row));
        }
        return values;
    }

    /** Phylogenetic species richness, PSV scaled by richness. */
    public static double[] psr(MetricsInput input) {
        double[] values = new double[input.unitCount()];
        for (int row = 0; row < values.length; row++) {
            int[] tips = input.presentTips(row);
            values[row] = psv(input, tips) * tips.length;
        }
        return values;
    }

    private static double psv(MetricsInput input, int[] tips) {
        int n = tips.length;
        if (n < 2) {
            return Double.NaN;
        }
        double trace = 0.0;
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            trace += input.correlation(tips[i], tips[i]);
            for (int j = 0; j < n; j++) {
                sum += input.correlation(tips[i], tips[j]);
            }
        }
        return (n * trace - sum) / (n * (n - 1.0));
    }

    /**
     * Phylogenetic species clustering with the row-maximum correction: one minus the mean, over
     * present species, of the strongest correlation with another present species.
     */
    public static double[] psc(MetricsInput input) {
        double[] values = new double[input.unitCount()];
        for (int row = 0; row < values.length; row++) {
            int[] tips = input.presentTips(row);
            int n = tips.length;
            if (n < 2) {
                values[row] = Double.NaN;
                continue;
            }
            double sumOfMax = 0.0;
            for (int i = 0; i < n; i++) {
                double max = -1.0;
                for (int j = 0; j < n; j++) {
                    if (i != j) {
                        max = Math.max(max, input.correlation(tips[i], tips[j]));
                    }
                }
                sumOfMax += max;
            }
            values[row] = 1.0 - sumOfMax / n;
        }
        return values;
    }

    /** Mean pairwise cophenetic distance among present species. */
    public static double[] mpd(MetricsInput input) {
        double[] values = new double[input.unitCount()];
        for (int row = 0; row < values.length; row++) {
            int[] tips = input.presentTips(row);
            int n = tips.length;
            if (n < 2) {
                values[row] = Double.NaN;
                continue;
            }
            double total = 0.0;
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    total += input.distance(tips[i], tips[j]);
                }
            }
            values[row] = total / (n * (n - 1) / 2.0);
        }
        return values;
    }

    /** Mean distance from each present species to its closest present relative. */
    public static double[] mntd(MetricsInput input) {
        double[] values = new double[input.unitCount()];
        for (int row = 0; row < values.length; row++) {
            int[] tips = input.presentTips(row);
            int n = tips.length;
            if (n < 2) {
                values[row] = Double.NaN;
                continue;
            }
            double total = 0.0;
            for (int i = 0; i < n; i++) {
                double nearest = Double.POSITIVE_INFINITY;
                for (int j = 0; j < n; j++) {
                    if (i != j) {
                        nearest = Math.min(nearest, input.distance(tips[i], tips[j]));
                    }
                }
                total += nearest;
            }
            values[row] = total / n;
        }
        return values;
    }

    /** Faith's phylogenetic diversity of the present species, root included. */
    public static double[] pd(MetricsInput input) {
        double[] values = new double[input.unitCount()];
        for (int row = 0; row < values.length; row++) {
            values[row] = input.tree() == null
                    ? 0.0
                    : input.tree().phylogeneticDiversity(input.cdm().presentSpecies(row));
        }
        return values;
    }
}
