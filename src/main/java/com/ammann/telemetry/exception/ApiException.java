package com.ammann.telemetry.exception;

/**
 * Base unchecked exception for all application-level errors raised by the analytics engine.
 *
 * <p>Subclasses represent specific error categories (invalid arguments, metrics store
 * failures) and are mapped to HTTP status codes by {@link GlobalExceptionHandler}.
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
