package com.pos.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
public class AddonSelectionResponse {
    private UUID addonId;
    private String name;
    private int quantity;
    private BigDecimal unitPrice;
}
