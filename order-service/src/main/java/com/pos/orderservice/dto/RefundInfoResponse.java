package com.pos.orderservice.dto;

import com.pos.orderservice.model.PaymentMethod;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class RefundInfoResponse {
    private PaymentMethod paymentMethod;
    private BigDecimal amount;
    private Integer loyaltyPointsToRefund;
}
