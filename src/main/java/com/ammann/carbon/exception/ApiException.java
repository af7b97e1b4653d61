/* (C)2026 */
package com.ammann.carbon.exception;

/**
 * Base unchecked exception for all application-level errors of the carbon intelligence service.
 *
 * <p>Subclasses represent specific error categories (insufficient history, failing data
 * providers, unavailable patterns, invalid input) and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}.
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
