package com.pos.orderservice.model;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED
}
