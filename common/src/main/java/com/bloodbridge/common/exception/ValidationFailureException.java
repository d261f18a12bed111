package com.bloodbridge.common.exception;

/**
 * Thrown when a value is outside its declared range. Request bodies are validated
 * by bean validation first; services re-check the structural invariants they rely on.
 */
public class ValidationFailureException extends BusinessException {
    public static final String CODE = "VALIDATION_ERROR";

    public ValidationFailureException(String message) {
        super(message, CODE);
    }
}
