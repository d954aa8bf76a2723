/* (C)2026 */
package com.ammann.metrictester.model;

import java.util.List;

/**
 * Long-format record of one null model's randomization run: one row per (replicate, unit).
 * Produced once by the randomization engine and never modified.
 *
 * @param nullModel name of the null model that produced the replicates
 * @param metrics metric columns, richness first
 * @param rows replicate rows ordered by replicate, then by unit
 */
public record ReplicateTable(String nullModel, List<String> metrics, List<ReplicateRow> rows) {

    public ReplicateTable {
        metrics = List.copyOf(metrics);
        rows = List.copyOf(rows);
    }

    /** Number of distinct replicates recorded. */
    public int replicateCount() {
        return (int) rows.stream().mapToInt(ReplicateRow::replicate).distinct().count();
    }

    /**
     * Metrics of one unit in one randomized matrix.
     *
     * @param replicate 1-based replicate index
     * @param row metric values of the unit
     */
    public record ReplicateRow(int replicate, MetricRow row) {}
}
