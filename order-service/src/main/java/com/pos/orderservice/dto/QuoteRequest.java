package com.pos.orderservice.dto;

import jakarta.validation.Valid;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class QuoteRequest {
    @Valid
    private List<OrderItemRequest> items = new ArrayList<>();
}
