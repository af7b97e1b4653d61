/* (C)2026 */
package com.ammann.carbon.exception;

/**
 * Thrown when a region has no cached pattern and computing the first one failed.
 *
 * <p>The cause carries the underlying {@link InsufficientDataException} or
 * {@link CollaboratorFetchException} when there is one. Mapped to HTTP 503 by
 * {@link GlobalExceptionHandler}.
 */
public class NoPatternAvailableException extends ApiException
{
    private final String region;

    public NoPatternAvailableException(String region, String reason, Throwable cause)
    {
        super(String.format("No carbon pattern available for region '%s': %s", region, reason), cause);
        this.region = region;
    }

    public String getRegion()
    {
        return region;
    }
}
