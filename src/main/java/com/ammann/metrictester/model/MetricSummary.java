/* (C)2026 */
package com.ammann.metrictester.model;

/**
 * Distribution of one metric over the replicate values of one group.
 *
 * @param count number of finite replicate values
 * @param mean sample mean, NaN without values
 * @param sd sample standard deviation, NaN with fewer than two values
 * @param lower lower bound of the two-sided interval
 * @param upper upper bound of the two-sided interval
 */
public record MetricSummary(long count, double mean, double sd, double lower, double upper) {}
