package com.pos.orderservice.service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Customer directory plus the running stats and loyalty balance kept per customer.
 * Stats only ever move through atomic increments.
 */
public interface CustomerLedger {

    /**
     * Finds the customer by phone, then by email, and creates one when neither matches.
     *
     * @return empty when neither phone nor email was given (walk-in order)
     */
    Optional<CustomerResolution> resolveCustomer(String phone, String email, String name);

    int pointsEarnedFor(BigDecimal orderTotal);

    /** Points charged when an order of this total is paid with loyalty points. */
    int pointsRequiredFor(BigDecimal orderTotal);

    /**
     * Links the order to the customer and adds one order, its total and the earned points.
     * Re-linking an already linked order does not count it twice.
     */
    void recordOrder(UUID customerId, UUID orderId, BigDecimal orderTotal, int earnedPoints);

    /** @return false when the balance does not cover {@code points}; nothing is changed then */
    boolean debitLoyaltyPoints(UUID customerId, int points);

    void creditLoyaltyPoints(UUID customerId, int points);
}
