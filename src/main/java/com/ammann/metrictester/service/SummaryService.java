/* (C)2026 */
package com.ammann.metrictester.service;

import com.ammann.metrictester.enumeration.GroupingMode;
import com.ammann.metrictester.exception.UnmatchedGroupingKeyException;
import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.GroupSummary;
import com.ammann.metrictester.model.MergedTable;
import com.ammann.metrictester.model.MergedTable.MergedRow;
import com.ammann.metrictester.model.MetricRow;
import com.ammann.metrictester.model.MetricSummary;
import com.ammann.metrictester.model.MetricTable;
import com.ammann.metrictester.model.ReplicateTable;
import com.ammann.metrictester.model.ReplicateTable.ReplicateRow;
import com.ammann.metrictester.model.SummaryTable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Reduces replicate tables to per-group distributions and aligns observed metrics with them.
 */
@ApplicationScoped
public class SummaryService {

    private static final Logger LOG = Logger.getLogger(SummaryService.class);

    private final double confidenceLevel;
    private final double criticalValue;

    @Inject
    public SummaryService(
            @ConfigProperty(name = "metrictester.summary.confidence-level", defaultValue = "0.95")
                    double confidenceLevel) {
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw ValidationException.invalidParameter(
                    "metrictester.summary.confidence-level", confidenceLevel, "value in (0, 1)");
        }
        this.confidenceLevel = confidenceLevel;
        this.criticalValue = new NormalDistribution().inverseCumulativeProbability(1.0 - (1.0 - confidenceLevel) / 2.0);
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    /**
     * Summarizes every metric except richness per grouping key.
     *
     * @param replicates replicate table of one null model
     * @param mode how replicate rows are pooled
     * @return one group per key seen in the replicates; richness keys in numeric order, unit
     *     keys in order of first appearance
     */
    public SummaryTable summarize(ReplicateTable replicates, GroupingMode mode) {
        if (replicates == null || mode == null) {
            throw new ValidationException("Summarizing requires a replicate table and a grouping mode");
        }
        List<String> metrics = testedMetrics(replicates.metrics());

        Map<String, Map<String, DescriptiveStatistics>> samples = new LinkedHashMap<>();
        for (ReplicateRow replicateRow : replicates.rows()) {
            MetricRow row = replicateRow.row();
            Map<String, DescriptiveStatistics> group = samples.computeIfAbsent(
                    mode.keyOf(row.unitId(), row.richness()), key -> newSamples(metrics));
            for (String metric : metrics) {
                double value = row.value(metric);
                if (!Double.isNaN(value)) {
                    group.get(metric).addValue(value);
                }
            }
        }

        List<String> keys = new ArrayList<>(samples.keySet());
        if (mode == GroupingMode.RICHNESS) {
            keys.sort(Comparator.comparingInt(Integer::parseInt));
        }
        Map<String, GroupSummary> groups = new LinkedHashMap<>();
        for (String key : keys) {
            Map<String, MetricSummary> summaries = new LinkedHashMap<>();
            samples.get(key).forEach((metric, stats) -> summaries.put(metric, describe(stats)));
            groups.put(key, new GroupSummary(key, summaries));
        }

        LOG.debugf("Summarized %d replicate rows of '%s' into %d %s groups",
                replicates.rows().size(), replicates.nullModel(), groups.size(), mode.getColumn());
        return new SummaryTable(replicates.nullModel(), mode, metrics, groups);
    }

    /**
     * Pairs every observed row with the summary of its grouping key.
     *
     * @param observed observed metric table
     * @param summary summary of one null model
     * @return merged rows in observed order
     * @throws UnmatchedGroupingKeyException if an observed unit's key has no summary
     * @throws ValidationException if an observed metric was not summarized
     */
    public MergedTable merge(MetricTable observed, SummaryTable summary) {
        if (observed == null || summary == null) {
            throw new ValidationException("Merging requires an observed table and a summary table");
        }
        List<String> metrics = testedMetrics(observed.metrics());
        for (String metric : metrics) {
            if (!summary.metrics().contains(metric)) {
                throw ValidationException.invalidParameter(
                        "metric", metric, "a metric summarized for null model '" + summary.nullModel() + "'");
            }
        }

        GroupingMode mode = summary.mode();
        List<MergedRow> rows = new ArrayList<>(observed.rows().size());
        for (MetricRow row : observed.rows()) {
            String key = mode.keyOf(row.unitId(), row.richness());
            GroupSummary group = summary.group(key)
                    .orElseThrow(() -> new UnmatchedGroupingKeyException(mode.getColumn(), key, row.unitId()));
            rows.add(new MergedRow(row, group));
        }
        return new MergedTable(summary.nullModel(), mode, metrics, rows);
    }

    private MetricSummary describe(DescriptiveStatistics stats) {
        long n = stats.getN();
        double mean = n > 0 ? stats.getMean() : Double.NaN;
        double sd = n > 1 ? stats.getStandardDeviation() : Double.NaN;
        return new MetricSummary(n, mean, sd, mean - criticalValue * sd, mean + criticalValue * sd);
    }

    private static Map<String, DescriptiveStatistics> newSamples(List<String> metrics) {
        Map<String, DescriptiveStatistics> samples = new LinkedHashMap<>();
        for (String metric : metrics) {
            samples.put(metric, new DescriptiveStatistics());
        }
        return samples;
    }

    static List<String> testedMetrics(List<String> metrics) {
        return metrics.stream().filter(metric -> !MetricTable.RICHNESS.equals(metric)).toList();
    }
}
