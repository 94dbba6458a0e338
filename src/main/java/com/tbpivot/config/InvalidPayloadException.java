package com.tbpivot.config;

/**
 * Raised when an export payload or report config cannot be used; always raised
 * before any telemetry is fetched.
 */
public class InvalidPayloadException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidPayloadException(String message) {
        super(message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
