package com.pos.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class OrderItemResponse {
    private UUID id;
    private Integer lineNumber;
    private UUID menuItemId;
    private String itemName;
    private Integer quantity;
    private BigDecimal unitPrice;
    private BigDecimal totalPrice;
    private boolean priceOverridden;
    private List<UUID> variantIds;
    private List<AddonSelectionResponse> addonSelections;
    private String specialInstructions;
}
