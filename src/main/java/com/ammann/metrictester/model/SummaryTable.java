/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.enumeration.GroupingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Randomization summary of one null model: one {@link GroupSummary} per grouping key seen in the
 * replicates.
 */
public record SummaryTable(
        String nullModel, GroupingMode mode, List<String> metrics, Map<String, GroupSummary> groups) {

    public SummaryTable {
        metrics = List.copyOf(metrics);
        groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    }

    public Optional<GroupSummary> group(String key) {
        return Optional.ofNullable(groups.get(key));
    }
}
