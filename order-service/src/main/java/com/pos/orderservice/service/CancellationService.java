package com.pos.orderservice.service;

import com.pos.orderservice.dto.CancellationResponse;
import com.pos.orderservice.dto.OrderResponse;
import com.pos.orderservice.dto.StatusHistoryResponse;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;
import java.util.UUID;

/**
 * Cancellation workflow: staff request, admin approval or rejection, refund and audit trail.
 */
public interface CancellationService {

    CancellationResponse requestCancellation(UUID orderId, String reason, Jwt jwt);

    CancellationResponse approveCancellation(UUID orderId, boolean approved, String adminNotes, Jwt jwt);

    /** Orders waiting for a decision, oldest request first. */
    List<OrderResponse> getCancellationRequests();

    List<StatusHistoryResponse> getOrderStatusHistory(UUID orderId);
}
