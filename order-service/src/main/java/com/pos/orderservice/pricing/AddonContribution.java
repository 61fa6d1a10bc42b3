package com.pos.orderservice.pricing;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
public class AddonContribution {
    private UUID addonId;
    private String name;
    private BigDecimal unitPrice; // effective price after presets
    private int quantity;
    private BigDecimal total;
}
