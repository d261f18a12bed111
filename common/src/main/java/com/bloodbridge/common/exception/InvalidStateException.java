package com.bloodbridge.common.exception;

/**
 * Thrown when an operation is attempted from a state that forbids it,
 * e.g. completing a donation that is no longer pending, or losing a race
 * on a conditional status transition.
 */
public class InvalidStateException extends BusinessException {
    public static final String CODE = "INVALID_STATE";

    public InvalidStateException(String message) {
        super(message, CODE);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause, CODE);
    }
}
