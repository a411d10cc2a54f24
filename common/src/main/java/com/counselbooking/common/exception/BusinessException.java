package com.counselbooking.common.exception;

import lombok.Getter;

/**
 * Root of the domain exception hierarchy.
 * Subclasses decide the HTTP status they are mapped to in {@link GlobalExceptionHandler}.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message) {
        super(message);
        this.errorCode = "BUSINESS_ERROR";
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
