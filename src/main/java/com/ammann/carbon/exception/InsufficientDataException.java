/* (C)2026 */
package com.ammann.carbon.exception;

/**
 * Thrown when fewer historical samples are available than a computation requires.
 *
 * <p>Recoverable: the pattern store answers with the previously cached pattern when one exists.
 * Mapped to HTTP 422 by {@link GlobalExceptionHandler} when it reaches a caller.
 */
public class InsufficientDataException extends ApiException
{
    private final int actual;
    private final int required;

    public InsufficientDataException(int actual, int required)
    {
        super(String.format(
                "Insufficient historical data: got %d samples, need at least %d", actual, required));
        this.actual = actual;
        this.required = required;
    }

    public int getActual()
    {
        return actual;
    }

    public int getRequired()
    {
        return required;
    }
}
