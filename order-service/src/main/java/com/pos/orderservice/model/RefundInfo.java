package com.pos.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Refund promised when the cancellation was requested.
 * Approval applies exactly these values; they are never recomputed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class RefundInfo {

    @Enumerated(EnumType.STRING)
    @Column(name = "refund_payment_method")
    private PaymentMethod paymentMethod;

    @Column(name = "refund_amount")
    private BigDecimal amount;

    // Only non-zero for loyalty-paid orders whose debit went through
    @Column(name = "refund_loyalty_points")
    private Integer loyaltyPointsToRefund;

    public boolean refundsLoyaltyPoints() {
        return loyaltyPointsToRefund != null && loyaltyPointsToRefund > 0;
    }
}
