package com.pos.orderservice.dto;

import com.pos.orderservice.model.PaymentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaymentStatusRequest {
    @NotNull(message = "Payment status cannot be null")
    private PaymentStatus paymentStatus;
}
