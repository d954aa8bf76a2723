/* (C)2026 */
package com.ammann.metrictester.enumeration;

import com.ammann.metrictester.exception.ValidationException;
import java.util.Locale;

/**
 * Alternative hypothesis of the one-sample location test.
 *
 * <p>{@link #GREATER} targets overdispersion (competition), {@link #LESS} targets clustering
 * (habitat filtering).
 */
public enum Alternative
{
    TWO_SIDED,
    GREATER,
    LESS;

    /**
     * Parses {@code two.sided}, {@code two-sided}, {@code greater} or {@code less} in any case.
     * A missing value means {@link #TWO_SIDED}.
     */
    public static Alternative parse(String value) {
        if (value == null || value.isBlank()) {
            return TWO_SIDED;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
        for (Alternative alternative : values()) {
            if (alternative.name().equals(normalized)) {
                return alternative;
            }
        }
        throw ValidationException.invalidParameter("alternative", value, "two.sided, greater or less");
    }
}
