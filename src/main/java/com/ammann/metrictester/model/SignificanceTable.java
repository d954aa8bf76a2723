/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.enumeration.GroupingMode;
import com.ammann.metrictester.enumeration.Significance;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Significance call of every observed metric value, one row per observed unit.
 */
public record SignificanceTable(
        String nullModel, GroupingMode mode, List<String> metrics, List<SignificanceRow> rows) {

    public SignificanceTable {
        metrics = List.copyOf(metrics);
        rows = List.copyOf(rows);
    }

    public record SignificanceRow(String unitId, String groupKey, Map<String, Significance> calls) {

        public SignificanceRow {
            calls = Collections.unmodifiableMap(new LinkedHashMap<>(calls));
        }
    }
}
