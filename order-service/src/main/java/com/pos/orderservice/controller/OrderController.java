package com.pos.orderservice.controller;

import com.pos.orderservice.dto.CreateOrderResponse;
import com.pos.orderservice.dto.OrderQuoteResponse;
import com.pos.orderservice.dto.OrderRequest;
import com.pos.orderservice.dto.OrderResponse;
import com.pos.orderservice.dto.PaymentStatusRequest;
import com.pos.orderservice.dto.QuoteRequest;
import com.pos.orderservice.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    public ResponseEntity<CreateOrderResponse> createOrder(
            @Valid @RequestBody OrderRequest orderRequest,
            @AuthenticationPrincipal Jwt jwt) {
        CreateOrderResponse response = orderService.createOrder(orderRequest, jwt);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    // Price preview, nothing is saved
    @PostMapping("/quote")
    public ResponseEntity<OrderQuoteResponse> quoteOrder(@Valid @RequestBody QuoteRequest quoteRequest) {
        return ResponseEntity.ok(orderService.quoteOrder(quoteRequest.getItems()));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable UUID orderId) {
        return ResponseEntity.ok(orderService.getOrder(orderId));
    }

    @GetMapping("/by-number/{orderNumber}")
    public ResponseEntity<OrderResponse> getOrderByNumber(@PathVariable String orderNumber) {
        return ResponseEntity.ok(orderService.getOrderByNumber(orderNumber));
    }

    @GetMapping("/customer/{customerId}")
    public ResponseEntity<List<OrderResponse>> getCustomerOrders(@PathVariable UUID customerId) {
        return ResponseEntity.ok(orderService.getCustomerOrders(customerId));
    }

    @PatchMapping("/{orderId}/payment")
    public ResponseEntity<OrderResponse> updatePaymentStatus(
            @PathVariable UUID orderId,
            @Valid @RequestBody PaymentStatusRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.updatePaymentStatus(orderId, request.getPaymentStatus(), jwt));
    }
}
