package com.ammann.telemetry.exception;

/**
 * Raised when telemetry, statistics or anomalies are requested before any dataset
 * has been loaded.
 *
 * <p>Mapped to HTTP 404 (Not Found) by {@link GlobalExceptionHandler}.
 */
public class NoDataAvailableException extends ApiException
{
    public NoDataAvailableException()
    {
        super("No data loaded");
    }
}
