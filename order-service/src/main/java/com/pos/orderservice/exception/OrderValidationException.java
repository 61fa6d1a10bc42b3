package com.pos.orderservice.exception;

/**
 * Exception thrown when a request is malformed in a way bean validation cannot catch,
 * for example an order without lines or a negative price override.
 * HTTP Status: 400 Bad Request
 */
public class OrderValidationException extends RuntimeException {

    private final ErrorCode errorCode;

    public OrderValidationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
