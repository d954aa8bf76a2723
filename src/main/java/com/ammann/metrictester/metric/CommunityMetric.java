/* (C)2026 */
package com.ammann.metrictester.metric;

import com.ammann.metrictester.model.MetricsInput;

/**
 * A community-structure metric: one scalar per unit of the prepared matrix, in row order.
 * Units for which the metric is undefined get {@link Double#NaN}.
 */
@FunctionalInterface
public interface CommunityMetric {

    double[] calculate(MetricsInput input);
}
