package com.pos.orderservice.pricing;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
public class VariantContribution {
    private UUID variantId;
    private String name;
    private BigDecimal price;
}
