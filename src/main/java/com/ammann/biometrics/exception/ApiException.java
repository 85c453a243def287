package com.ammann.biometrics.exception;

/**
 * Base unchecked exception for all application-level errors of the analytics API.
 *
 * <p>Subclasses represent specific error categories (validation, upstream time-series
 * failures, rejected alert transitions) and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}.
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
