package com.pos.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class CustomerSummary {
    private UUID id;
    private String name;
    private String phone;
    private String email;
    private Integer loyaltyPoints;
    private Integer totalOrders;
    private Boolean isNew; // created by this order
}
