package com.pos.orderservice.dto;

import com.pos.orderservice.pricing.PriceBreakdown;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class OrderQuoteResponse {
    private List<Line> lines;
    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal total;

    @Data
    @Builder
    public static class Line {
        private UUID menuItemId;
        private String itemName;
        private int quantity;
        private BigDecimal unitPrice;
        private BigDecimal lineTotal;
        private boolean priceOverridden;
        private PriceBreakdown breakdown; // null when the price was overridden
    }
}
