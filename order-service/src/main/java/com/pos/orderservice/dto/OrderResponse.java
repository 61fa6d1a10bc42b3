package com.pos.orderservice.dto;

import com.pos.orderservice.model.PaymentMethod;
import com.pos.orderservice.model.PaymentStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class OrderResponse {
    private UUID id;
    private String orderNumber;
    private UUID customerId;
    private String customerName;
    private String customerPhone;
    private List<OrderItemResponse> items;
    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal total;
    private PaymentMethod paymentMethod;
    private PaymentStatus paymentStatus;
    private int loyaltyPointsRedeemed;
    private int loyaltyPointsEarned;
    private String notes;
    private UUID locationId;
    private UUID createdBy;
    private CancellationInfoResponse cancellation;
    private Instant createdAt;
    private Instant updatedAt;
}
