package com.pos.orderservice.dto;

import com.pos.orderservice.model.CancellationStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class StatusHistoryResponse {
    private Long id;
    private UUID orderId;
    private CancellationStatus previousStatus;
    private CancellationStatus newStatus;
    private String reason;
    private UUID changedBy;
    private Instant createdAt;
}
