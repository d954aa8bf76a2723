/* (C)2026 */
package com.ammann.metrictester.exception;

/**
 * Raised when an operation receives something other than the prepared context it expects,
 * for example a randomization run started without a {@code NullsInput}.
 */
public class InvalidInputTypeException extends ValidationException {

    public InvalidInputTypeException(String message) {
        super(message);
    }

    /**
     * Creates the exception for a missing or foreign context object.
     *
     * @param expected simple name of the expected context type
     * @param actual the object that was passed instead, may be {@code null}
     */
    public static InvalidInputTypeException expected(String expected, Object actual) {
        String got = actual == null ? "null" : actual.getClass().getSimpleName();
        return new InvalidInputTypeException(
                String.format("Input needs to be a prepared %s, but got %s", expected, got));
    }
}
