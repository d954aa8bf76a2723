/* (C)2026 */
package com.ammann.metrictester.exception;

/**
 * Generic internal error exception for unexpected failures that do not fit a more
 * specific exception category, such as a randomization worker dying with a checked error.
 *
 * <p>Mapped to HTTP 500 (Internal Server Error) by {@link GlobalExceptionHandler}.
 */
public class SomeThingWentWrongException extends ApiException
{
    public SomeThingWentWrongException(Throwable cause)
    {
        super("Some thing went wrong", cause);
    }
}
