package com.pos.orderservice.pricing;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Unit price of one order line before quantity is applied.
 * For items with variants basePrice is zero and the variants carry the price.
 */
@Data
@Builder
public class PriceBreakdown {
    private UUID menuItemId;
    private String menuItemName;
    private BigDecimal basePrice;
    private List<VariantContribution> variantContributions;
    private List<AddonContribution> addonContributions;
    private BigDecimal addonsTotal;
    private BigDecimal totalPrice;
}
