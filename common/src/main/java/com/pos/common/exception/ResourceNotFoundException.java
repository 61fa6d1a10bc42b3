package com.pos.common.exception;

/**
 * Exception thrown when a requested resource does not exist
 * HTTP Status: 404 Not Found (set in GlobalExceptionHandler)
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String errorCode;

    public ResourceNotFoundException(String message) {
        this(message, "RESOURCE_NOT_FOUND");
    }

    public ResourceNotFoundException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
