package com.pos.orderservice.dto;

import com.pos.orderservice.model.PaymentMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
public class OrderRequest {

    // Optional customer identity; phone is looked up first, then email
    @Size(max = 20, message = "Phone number is too long")
    private String customerPhone;

    @Size(max = 100, message = "Customer name is too long")
    private String customerName;

    @Email(message = "Customer email must be a valid email address")
    private String customerEmail;

    // An empty list is rejected by the service with EMPTY_ORDER
    @Valid // Triggers validation for each OrderItemRequest in the list
    private List<OrderItemRequest> items = new ArrayList<>();

    @NotNull(message = "Payment method cannot be null")
    private PaymentMethod paymentMethod;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    private String notes;

    private UUID locationId;
}
