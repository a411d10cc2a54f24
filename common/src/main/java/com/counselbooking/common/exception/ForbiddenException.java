package com.counselbooking.common.exception;

/**
 * The caller is known but may not act on the resource. Mapped to HTTP 403.
 */
public class ForbiddenException extends BusinessException {

    public ForbiddenException(String message) {
        super(message, "FORBIDDEN");
    }
}
