package com.ammann.telemetry.exception;

/**
 * Exception indicating that a read from the {@link com.ammann.telemetry.store.MetricsStore}
 * failed or was interrupted.
 *
 * <p>The analytics services never swallow this exception; it propagates to the caller,
 * which decides whether to skip the entity, retry, or degrade the cycle.
 * Mapped to HTTP 503 (Service Unavailable) by {@link GlobalExceptionHandler}.
 */
public class MetricsStoreException extends ApiException
{
    public MetricsStoreException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public MetricsStoreException(String message)
    {
        super(message);
    }
}
