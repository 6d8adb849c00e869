package com.ammann.telemetry.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.time.LocalDateTime;
import java.util.concurrent.CancellationException;

/**
 * Global JAX-RS exception mapper that translates analytics and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Metrics store failures and cancelled fleet runs surface as HTTP 503 so that callers
 * can retry on their own schedule. Unhandled exceptions are logged at ERROR level and
 * returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof ValidationException) {
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path
            );
        }

        if (exception instanceof MetricsStoreException) {
            LOG.warnf("Metrics store error on %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.SERVICE_UNAVAILABLE,
                    exception.getMessage(),
                    "METRICS_STORE_ERROR",
                    path
            );
        }

        if (exception instanceof CancellationException) {
            LOG.debugf("Request on %s cancelled: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.SERVICE_UNAVAILABLE,
                    "Computation was cancelled",
                    "CANCELLED",
                    path
            );
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    path
            );
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path)
    {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status.getStatusCode());
        return Response.status(status).entity(errorResponse).build();
    }


    /**
     * Structured error response body returned to API clients.
     */
    public static class ErrorResponse
    {
        public String code;
        public String message;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;

        public ErrorResponse(String code, String message, String path, Integer status)
        {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
            this.path = path;
            this.status = status;
        }
    }
}
