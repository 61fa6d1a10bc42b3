package com.pos.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Contract for order activity events.
 *
 * Used for events like:
 * - order.created
 * - order.cancellation_requested
 * - order.cancellation_approved
 * - order.cancellation_rejected
 *
 * Consumers (activity log, dashboards) only need identity, money and the actor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderActivityContract {
    private UUID orderId;
    private String orderNumber;
    private UUID customerId;          // nullable for walk-in orders
    private UUID actorId;             // staff user who triggered the event
    private BigDecimal total;
    private String paymentMethod;     // CASH, CARD, UPI, LOYALTY
    private String cancellationStatus; // NONE, REQUESTED, APPROVED, REJECTED
    private String reason;            // cancellation reason or admin notes
    private BigDecimal refundAmount;  // nullable unless a cancellation is involved
    private Integer refundLoyaltyPoints;
    private Instant occurredAt;
}
