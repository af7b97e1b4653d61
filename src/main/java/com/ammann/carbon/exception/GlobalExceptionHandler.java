/* (C)2026 */
package com.ammann.carbon.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.time.LocalDateTime;

/**
 * Global JAX-RS exception mapper that translates application and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Handles validation, insufficient history, data provider and pattern availability errors.
 * Unhandled exceptions are logged at ERROR level and returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    static final int UNPROCESSABLE_ENTITY = 422;

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof ValidationException) {
            return createResponse(
                    Response.Status.BAD_REQUEST.getStatusCode(),
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path
            );
        }

        if (exception instanceof InsufficientDataException) {
            LOG.debugf("Insufficient data for path %s: %s", path, exception.getMessage());
            return createResponse(
                    UNPROCESSABLE_ENTITY,
                    exception.getMessage(),
                    "INSUFFICIENT_DATA",
                    path
            );
        }

        if (exception instanceof CollaboratorFetchException) {
            LOG.warnf("Carbon data provider error: %s", exception.getMessage());
            return createResponse(
                    Response.Status.BAD_GATEWAY.getStatusCode(),
                    exception.getMessage(),
                    "DATA_SOURCE_ERROR",
                    path
            );
        }

        if (exception instanceof NoPatternAvailableException) {
            LOG.warnf("Pattern unavailable: %s", exception.getMessage());
            return createResponse(
                    Response.Status.SERVICE_UNAVAILABLE.getStatusCode(),
                    exception.getMessage(),
                    "PATTERN_UNAVAILABLE",
                    path
            );
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND.getStatusCode(),
                    exception.getMessage(),
                    "NOT_FOUND",
                    path
            );
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(int status, String message, String code, String path)
    {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status);
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

        public ErrorResponse(String code, String message)
        {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
        }

        public ErrorResponse(String code, String message, String path, Integer status)
        {
            this(code, message);
            this.path = path;
            this.status = status;
        }
    }
}
