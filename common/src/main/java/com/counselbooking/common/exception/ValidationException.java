package com.counselbooking.common.exception;

import lombok.Getter;

/**
 * Caller-correctable input error. Raised before any store access.
 */
@Getter
public class ValidationException extends BusinessException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message, "VALIDATION_ERROR");
        this.field = field;
    }
}
