/* (C)2026 */
package com.ammann.metrictester.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one null model contributed to an analysis.
 *
 * @param replicates raw replicate metrics
 * @param summary per-group null distributions
 * @param ses standardized effect sizes of the observed units
 * @param significance significance calls of the observed units
 * @param robust signed-rank test of every SES column
 */
public record NullModelResult(
        ReplicateTable replicates,
        SummaryTable summary,
        SesTable ses,
        SignificanceTable significance,
        Map<String, RobustTestResult> robust) {

    public NullModelResult {
        robust = Collections.unmodifiableMap(new LinkedHashMap<>(robust));
    }
}
