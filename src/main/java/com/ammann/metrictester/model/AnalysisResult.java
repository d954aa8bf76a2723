/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.enumeration.Alternative;
import com.ammann.metrictester.enumeration.GroupingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a complete analysis: the observed metrics and one {@link NullModelResult} per null
 * model, in selection order.
 */
public record AnalysisResult(
        MetricTable observed,
        GroupingMode mode,
        Alternative alternative,
        Map<String, NullModelResult> nulls) {

    public AnalysisResult {
        nulls = Collections.unmodifiableMap(new LinkedHashMap<>(nulls));
    }
}
