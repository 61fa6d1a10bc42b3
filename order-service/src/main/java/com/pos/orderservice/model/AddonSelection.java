package com.pos.orderservice.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Addon chosen for an order line, stored as JSON on the line.
 * unitPrice is the effective price at the time of the order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddonSelection {
    private UUID addonId;
    private String name;
    private int quantity;
    private BigDecimal unitPrice;
}
