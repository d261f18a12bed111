package com.bloodbridge.common.exception;

/**
 * Thrown when the acting user is not the owner of the record, or lacks the role
 * the operation requires.
 */
public class ForbiddenOperationException extends BusinessException {
    public static final String CODE = "FORBIDDEN";

    public ForbiddenOperationException(String message) {
        super(message, CODE);
    }
}
