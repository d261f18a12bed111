package com.bloodbridge.common.exception;

import lombok.Getter;

/**
 * Base class for every rule violation the domain reports to its caller.
 * The {@code errorCode} is stable and is what clients branch on.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message) {
        this(message, "BUSINESS_ERROR");
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
