package com.counselbooking.common.exception;

/**
 * Thrown when a required dependency (booking lock, lock store) is temporarily unavailable.
 * Client should retry the same request later.
 * Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
