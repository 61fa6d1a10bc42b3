package com.pos.orderservice.exception;

/**
 * Exception thrown when a cancellation transition is not allowed from the current state,
 * including the case where a concurrent request changed the state first.
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidOrderStateException extends RuntimeException {

    private final ErrorCode errorCode;

    public InvalidOrderStateException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public InvalidOrderStateException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
