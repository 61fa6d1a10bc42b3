package com.pos.orderservice.controller;

import com.pos.orderservice.dto.CancellationDecisionRequest;
import com.pos.orderservice.dto.CancellationRequest;
import com.pos.orderservice.dto.CancellationResponse;
import com.pos.orderservice.dto.OrderResponse;
import com.pos.orderservice.dto.StatusHistoryResponse;
import com.pos.orderservice.service.CancellationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class CancellationController {

    private final CancellationService cancellationService;

    @PostMapping("/{orderId}/cancellation-request")
    public ResponseEntity<CancellationResponse> requestCancellation(
            @PathVariable UUID orderId,
            @Valid @RequestBody CancellationRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(cancellationService.requestCancellation(orderId, request.getReason(), jwt));
    }

    @PostMapping("/{orderId}/cancellation-decision")
    public ResponseEntity<CancellationResponse> decideCancellation(
            @PathVariable UUID orderId,
            @Valid @RequestBody CancellationDecisionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(cancellationService.approveCancellation(
                orderId, request.getApproved(), request.getAdminNotes(), jwt));
    }

    @GetMapping("/cancellation-requests")
    public ResponseEntity<List<OrderResponse>> getCancellationRequests() {
        return ResponseEntity.ok(cancellationService.getCancellationRequests());
    }

    @GetMapping("/{orderId}/status-history")
    public ResponseEntity<List<StatusHistoryResponse>> getOrderStatusHistory(@PathVariable UUID orderId) {
        return ResponseEntity.ok(cancellationService.getOrderStatusHistory(orderId));
    }
}
