package com.pos.orderservice.service;

import com.pos.orderservice.dto.CreateOrderResponse;
import com.pos.orderservice.dto.OrderItemRequest;
import com.pos.orderservice.dto.OrderQuoteResponse;
import com.pos.orderservice.dto.OrderRequest;
import com.pos.orderservice.dto.OrderResponse;
import com.pos.orderservice.model.PaymentStatus;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;
import java.util.UUID;

public interface OrderService {

    CreateOrderResponse createOrder(OrderRequest orderRequest, Jwt jwt);

    OrderQuoteResponse quoteOrder(List<OrderItemRequest> items);

    OrderResponse getOrder(UUID orderId);

    OrderResponse getOrderByNumber(String orderNumber);

    List<OrderResponse> getCustomerOrders(UUID customerId);

    OrderResponse updatePaymentStatus(UUID orderId, PaymentStatus paymentStatus, Jwt jwt);
}
