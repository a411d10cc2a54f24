package com.counselbooking.common.exception;

/**
 * The request is well-formed but clashes with current state. Mapped to HTTP 409.
 */
public class ConflictException extends BusinessException {

    public ConflictException(String message) {
        super(message, "CONFLICT");
    }

    public ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ConflictException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }

    /**
     * Extra payload rendered next to the error message (e.g. conflicting appointment ids).
     */
    public Object getDetails() {
        return null;
    }
}
