package com.pos.common.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Menu item snapshot published by the menu service on "menu.item.updated".
 *
 * The menu service emits snake_case field names. This class is the only place
 * that knows about that shape; everything behind it works with the camelCase model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MenuItemEventDto {
    private UUID menuItemId;
    private UUID categoryId;
    private String name;
    private BigDecimal basePrice;   // null when the item has variants
    private boolean hasVariants;
    @JsonProperty("is_available")
    private boolean available;

    @Builder.Default
    private List<Variant> variants = new ArrayList<>();

    @Builder.Default
    private List<Addon> addons = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Variant {
        private UUID variantId;
        private String name;
        private BigDecimal price;
        @JsonProperty("is_available")
        private boolean available;
    }

    /**
     * One addon as seen from this menu item. Overrides are the raw preset values,
     * precedence is resolved by the consumer.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Addon {
        private UUID addonId;
        private String name;
        private BigDecimal price;
        private BigDecimal categoryPriceOverride;
        private BigDecimal itemPriceOverride;
        private boolean categoryLinked;
        private Boolean itemAllowed;    // null when no item-level rule exists
        private Integer maxQuantity;
        @JsonProperty("is_available")
        private boolean available;
    }
}
