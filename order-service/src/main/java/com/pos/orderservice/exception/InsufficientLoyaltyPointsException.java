package com.pos.orderservice.exception;

/**
 * Exception thrown when a loyalty payment is not covered by the customer's balance.
 * Terminal for that order attempt.
 * HTTP Status: 422 Unprocessable Entity
 */
public class InsufficientLoyaltyPointsException extends RuntimeException {

    public InsufficientLoyaltyPointsException(String message) {
        super(message);
    }
}
