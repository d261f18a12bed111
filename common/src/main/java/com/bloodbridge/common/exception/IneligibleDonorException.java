package com.bloodbridge.common.exception;

/**
 * Thrown when a user may not donate right now: not a donor, marked unavailable,
 * or still inside the cooldown window.
 */
public class IneligibleDonorException extends BusinessException {
    public static final String CODE = "INELIGIBLE_DONOR";

    public IneligibleDonorException(String message) {
        super(message, CODE);
    }
}
