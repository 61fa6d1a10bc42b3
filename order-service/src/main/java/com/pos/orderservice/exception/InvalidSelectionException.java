package com.pos.orderservice.exception;

/**
 * Exception thrown when a variant/addon selection cannot be priced for a menu item.
 * For example: a required variant is missing, or an addon is not offered on the item.
 * HTTP Status: 400 Bad Request
 */
public class InvalidSelectionException extends RuntimeException {

    public InvalidSelectionException(String message) {
        super(message);
    }
}
