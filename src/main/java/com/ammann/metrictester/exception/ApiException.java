/* (C)2026 */
package com.ammann.metrictester.exception;

/**
 * Base unchecked exception for all application-level errors in the metric tester API.
 *
 * <p>Subclasses represent specific error categories (validation, infeasible sampling
 * parameters, misaligned summary tables, internal errors) and are mapped to appropriate
 * HTTP status codes by {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}
