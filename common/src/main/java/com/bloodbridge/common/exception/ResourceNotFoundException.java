package com.bloodbridge.common.exception;

/**
 * Thrown when an id has no stored record.
 */
public class ResourceNotFoundException extends BusinessException {
    public static final String CODE = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String message) {
        super(message, CODE);
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), CODE);
    }
}
