package com.pos.orderservice.exception;

/**
 * Exception thrown when an order line names a menu item that is switched off.
 * HTTP Status: 422 Unprocessable Entity
 */
public class ItemUnavailableException extends RuntimeException {

    public ItemUnavailableException(String message) {
        super(message);
    }
}
