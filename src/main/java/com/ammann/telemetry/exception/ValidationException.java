package com.ammann.telemetry.exception;

/**
 * Exception indicating that a caller-supplied argument does not meet the constraints
 * of the requested computation.
 *
 * <p>Insufficient data is not a validation failure: services report it as a
 * {@code null} result. This exception covers malformed input only (missing identifiers,
 * non-positive windows or horizons, non-finite values).
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    /**
     * Creates validation exception for a missing required argument.
     */
    public static ValidationException missingParameter(String paramName) {
        return new ValidationException(
                String.format("Missing required parameter '%s'", paramName));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
