package com.pos.orderservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
public class OrderItemRequest {
    @NotNull(message = "Menu item ID cannot be null")
    private UUID menuItemId;

    @NotNull(message = "Quantity cannot be null")
    @Min(value = 1, message = "Quantity must be at least 1")
    @Max(value = 100, message = "Quantity must be at most 100")
    private Integer quantity;

    private List<UUID> variantIds = new ArrayList<>();

    @Valid
    private List<AddonSelectionRequest> addonSelections = new ArrayList<>();

    @Size(max = 500, message = "Special instructions must be at most 500 characters")
    private String specialInstructions;

    // Staff-entered unit price, bypasses menu pricing. Must not be negative.
    private BigDecimal customUnitPrice;
}
