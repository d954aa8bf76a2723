/* (C)2026 */
package com.ammann.metrictester.service;

import com.ammann.metrictester.enumeration.Alternative;
import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.MetricTable;
import com.ammann.metrictester.model.RobustTestResult;
import com.ammann.metrictester.model.SesTable;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;
import org.jboss.logging.Logger;

/**
 * One-sample Wilcoxon signed-rank test of each metric column against a location of zero.
 *
 * <p>Non-finite values and exact zeros are dropped before ranking. Below
 * {@value #EXACT_LIMIT} remaining values, with no ties and no dropped zeros, the p-value comes
 * from the exact null distribution of the statistic; otherwise from the normal approximation
 * with tie and continuity corrections. A column without usable values yields a NaN p-value
 * rather than an error.
 */
@ApplicationScoped
public class RobustTestService {

    private static final Logger LOG = Logger.getLogger(RobustTestService.class);

    static final int EXACT_LIMIT = 50;

    private static final String QUADRAT_COLUMN = "quadrat";

    private final NormalDistribution standardNormal = new NormalDistribution();
    private final NaturalRanking ranking = new NaturalRanking(NaNStrategy.FIXED, TiesStrategy.AVERAGE);

    /** Tests every SES column. */
    public Map<String, RobustTestResult> test(SesTable ses, Alternative alternative) {
        if (ses == null) {
            throw new ValidationException("Robust test requires an SES table");
        }
        return testColumns(ses.columns(), alternative);
    }

    /** Tests every metric column of an observed or replicate table; richness is skipped. */
    public Map<String, RobustTestResult> test(MetricTable table, Alternative alternative) {
        if (table == null) {
            throw new ValidationException("Robust test requires a metric table");
        }
        return testColumns(table.columns(), alternative);
    }

    /**
     * Tests named columns. Columns named {@code richness} or {@code quadrat} are skipped.
     *
     * @param columns values by column name
     * @param alternative alternative hypothesis
     * @return one result per tested column, in column order
     */
    public Map<String, RobustTestResult> testColumns(Map<String, double[]> columns, Alternative alternative) {
        if (columns == null) {
            throw new ValidationException("Robust test requires columns to test");
        }
        if (alternative == null) {
            throw ValidationException.invalidParameter("alternative", null, "one of " + Arrays.toString(Alternative.values()));
        }
        Map<String, RobustTestResult> results = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            if (MetricTable.RICHNESS.equals(name) || QUADRAT_COLUMN.equals(name)) {
                return;
            }
            if (values == null) {
                throw ValidationException.invalidParameter("column", name, "an array of values");
            }
            results.put(name, test(name, values, alternative));
        });
        return results;
    }

    RobustTestResult test(String column, double[] values, Alternative alternative) {
        double[] finite = Arrays.stream(values).filter(Double::isFinite).toArray();
        double estimate = finite.length > 0 ? Arrays.stream(finite).average().orElse(Double.NaN) : Double.NaN;
        double[] nonZero = Arrays.stream(finite).filter(v -> v != 0.0).toArray();
        boolean zeros = nonZero.length < finite.length;
        int n = nonZero.length;
        if (n == 0) {
            LOG.debugf("Column '%s' has no non-zero finite values, p-value undefined", column);
            return new RobustTestResult(estimate, Double.NaN, 0, 0.0, false);
        }

        double[] absolute = Arrays.stream(nonZero).map(Math::abs).toArray();
        double[] ranks = ranking.rank(absolute);
        double statistic = 0.0;
        for (int i = 0; i < n; i++) {
            if (nonZero[i] > 0) {
                statistic += ranks[i];
            }
        }
        boolean ties = Arrays.stream(ranks).distinct().count() < n;

        if (n < EXACT_LIMIT && !ties && !zeros) {
            return new RobustTestResult(estimate, exactPValue(statistic, n, alternative), n, statistic, true);
        }
        if (n < EXACT_LIMIT) {
            LOG.warnf("Column '%s': cannot compute exact p-value with %s, using normal approximation",
                    column, ties && zeros ? "ties and zeroes" : ties ? "ties" : "zeroes");
        }
        return new RobustTestResult(
                estimate, approximatePValue(statistic, ranks, alternative), n, statistic, false);
    }

    private static double exactPValue(double statistic, int n, Alternative alternative) {
        double[] cumulative = signedRankCdf(n);
        int v = (int) Math.round(statistic);
        switch (alternative) {
            case GREATER:
                return upperTail(cumulative, v);
            case LESS:
                return cumulative[v];
            default:
                double p = statistic > n * (n + 1) / 4.0 ? upperTail(cumulative, v) : cumulative[v];
                return Math.min(2.0 * p, 1.0);
        }
    }

    /** P(V >= v). */
    private static double upperTail(double[] cumulative, int v) {
        return v == 0 ? 1.0 : 1.0 - cumulative[v - 1];
    }

    /** Cumulative distribution P(V <= k) of the signed-rank statistic for {@code n} values. */
    static double[] signedRankCdf(int n) {
        int max = n * (n + 1) / 2;
        double[] counts = new double[max + 1];
        counts[0] = 1.0;
        for (int rank = 1; rank <= n; rank++) {
            int reach = rank * (rank + 1) / 2;
            for (int sum = reach; sum >= rank; sum--) {
                counts[sum] += counts[sum - rank];
            }
        }
        double total = Math.pow(2.0, n);
        double[] cumulative = new double[max + 1];
        double running = 0.0;
        for (int k = 0; k <= max; k++) {
            running += counts[k];
            cumulative[k] = Math.min(running / total, 1.0);
        }
        return cumulative;
    }

    private double approximatePValue(double statistic, double[] ranks, Alternative alternative) {
        int n = ranks.length;
        double z = statistic - n * (n + 1) / 4.0;

        Map<Double, Integer> tieGroups = new LinkedHashMap<>();
        for (double rank : ranks) {
            tieGroups.merge(rank, 1, Integer::sum);
        }
        double tieAdjustment = 0.0;
        for (int size : tieGroups.values()) {
            tieAdjustment += (double) size * size * size - size;
        }
        double sigma = Math.sqrt(n * (n + 1.0) * (2.0 * n + 1.0) / 24.0 - tieAdjustment / 48.0);
        if (!(sigma > 0.0)) {
            return Double.NaN;
        }

        double correction;
        switch (alternative) {
            case GREATER:
                correction = 0.5;
                break;
            case LESS:
                correction = -0.5;
                break;
            default:
                correction = Math.signum(z) * 0.5;
        }
        z = (z - correction) / sigma;

        switch (alternative) {
            case GREATER:
                return 1.0 - standardNormal.cumulativeProbability(z);
            case LESS:
                return standardNormal.cumulativeProbability(z);
            default:
                double lower = standardNormal.cumulativeProbability(z);
                return 2.0 * Math.min(lower, 1.0 - lower);
        }
    }
}
