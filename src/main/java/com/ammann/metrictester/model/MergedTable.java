/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.enumeration.GroupingMode;
import java.util.List;

/**
 * Observed metrics aligned with the randomization summary of their grouping key. Every observed
 * unit has exactly one row.
 *
 * @param nullModel null model whose summary was merged
 * @param mode grouping mode of the summary
 * @param metrics metrics to test, without richness
 * @param rows one row per observed unit, in observed order
 */
public record MergedTable(String nullModel, GroupingMode mode, List<String> metrics, List<MergedRow> rows) {

    public MergedTable {
        metrics = List.copyOf(metrics);
        rows = List.copyOf(rows);
    }

    public record MergedRow(MetricRow observed, GroupSummary group) {

        public String groupKey() {
            return group.key();
        }
    }
}
