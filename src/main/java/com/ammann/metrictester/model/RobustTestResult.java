/* (C)2026 */
package com.ammann.metrictester.model;

/**
 * Outcome of the one-sample location test for one column.
 *
 * @param estimate mean of the finite values
 * @param pValue p-value, NaN when the test has no usable observation
 * @param n number of non-zero, finite values entering the rank statistic
 * @param statistic signed-rank statistic V (sum of positive ranks)
 * @param exact whether the p-value comes from the exact null distribution
 */
public record RobustTestResult(double estimate, double pValue, int n, double statistic, boolean exact) {}
