/* (C)2026 */
package com.ammann.metrictester.exception;

/**
 * Raised when an observed row cannot be aligned with a row of the randomization summary.
 *
 * <p>Mapped to HTTP 409 (Conflict) by {@link GlobalExceptionHandler}.
 */
public class UnmatchedGroupingKeyException extends ApiException {

    private final String groupingKey;

    public UnmatchedGroupingKeyException(String groupingColumn, String groupingKey, String unitId) {
        super(String.format(
                "No randomization summary for %s '%s' (observed unit '%s')",
                groupingColumn, groupingKey, unitId));
        this.groupingKey = groupingKey;
    }

    public String getGroupingKey() {
        return groupingKey;
    }
}
