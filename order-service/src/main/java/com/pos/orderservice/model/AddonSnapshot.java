package com.pos.orderservice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * An addon as offered on one menu item, with both price presets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddonSnapshot {
    private UUID addonId;
    private String name;
    private BigDecimal basePrice;
    private BigDecimal categoryPriceOverride;
    private BigDecimal itemPriceOverride;

    // Linked to the item's category
    private boolean categoryLinked;

    // Item-level rule; null means "inherit from category"
    private Boolean itemAllowed;

    private Integer maxQuantity;
    private boolean available;

    @JsonIgnore
    public boolean isEligible() {
        if (!available) {
            return false;
        }
        return itemAllowed != null ? itemAllowed : categoryLinked;
    }

    // item override -> category override -> addon price
    @JsonIgnore
    public BigDecimal getEffectivePrice() {
        if (itemPriceOverride != null) {
            return itemPriceOverride;
        }
        if (categoryPriceOverride != null) {
            return categoryPriceOverride;
        }
        return basePrice;
    }
}
