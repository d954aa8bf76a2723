/* (C)2026 */
package com.ammann.metrictester.enumeration;

/**
 * Outcome of comparing an observed metric value with the null confidence bounds: one of the
 * three coded calls, or {@link #UNDEFINED} when the comparison cannot be made.
 */
public enum Significance
{
    /** Observed value lies within the bounds. */
    NOT_SIGNIFICANT(0),
    /** Observed value lies below the lower bound. */
    CLUSTERED(1),
    /** Observed value lies above the upper bound. */
    OVERDISPERSED(2),
    /** Observed value or a bound is NaN; carries no code. */
    UNDEFINED(null);

    private final Integer code;

    Significance(Integer code) {
        this.code = code;
    }

    /**
     * Classifies an observed value against a confidence interval.
     *
     * <p>The upper bound is tested first, so with inverted bounds ({@code lower > upper}) a value
     * above both is reported as overdispersed. Inverted bounds should not occur and may point to
     * an upstream defect. A NaN observation or bound, as left by a group with fewer than two
     * replicate values, gives {@link #UNDEFINED}.
     *
     * @param observed observed metric value
     * @param lower lower confidence bound
     * @param upper upper confidence bound
     * @return the classification
     */
    public static Significance classify(double observed, double lower, double upper) {
        if (Double.isNaN(observed) || Double.isNaN(lower) || Double.isNaN(upper)) return UNDEFINED;
        if (observed > upper) return OVERDISPERSED;
        if (observed < lower) return CLUSTERED;
        return NOT_SIGNIFICANT;
    }

    public static Significance fromCode(int code) {
        for (Significance significance : values()) {
            if (significance.code != null && significance.code == code) {
                return significance;
            }
        }
        throw new IllegalArgumentException("Unknown significance code: " + code);
    }

    /** Numeric code, {@code null} for {@link #UNDEFINED}. */
    public Integer getCode() { return code; }
}
