package com.pos.orderservice.model;

public enum PaymentMethod {
    CASH,
    CARD,
    UPI,
    LOYALTY  // paid in full with the customer's loyalty points
}
