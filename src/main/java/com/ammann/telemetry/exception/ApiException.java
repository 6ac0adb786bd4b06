package com.ammann.telemetry.exception;

/**
 * Base unchecked exception for all application-level errors in the telemetry API.
 *
 * <p>Subclasses represent specific error categories (validation, missing dataset) and are
 * mapped to appropriate HTTP status codes by {@link GlobalExceptionHandler}.
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
