package com.pos.orderservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddonSelectionRequest {
    @NotNull(message = "Add-on ID cannot be null")
    private UUID addonId;

    @NotNull(message = "Add-on quantity cannot be null")
    private Integer quantity;
}
