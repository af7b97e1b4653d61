/* (C)2026 */
package com.ammann.carbon.exception;

/**
 * Thrown when a carbon data provider fails to deliver historical samples, the current reading
 * or a forecast.
 *
 * <p>Mapped to HTTP 502 (Bad Gateway) by {@link GlobalExceptionHandler}.
 */
public class CollaboratorFetchException extends ApiException
{
    private final String region;
    private final String operation;

    public CollaboratorFetchException(String region, String operation, String message, Throwable cause)
    {
        super(String.format("Failed to %s for region '%s': %s", operation, region, message), cause);
        this.region = region;
        this.operation = operation;
    }

    public CollaboratorFetchException(String region, String operation, String message)
    {
        this(region, operation, message, null);
    }

    public String getRegion()
    {
        return region;
    }

    public String getOperation()
    {
        return operation;
    }
}
