package com.pos.orderservice.dto;

import com.pos.orderservice.model.CancellationStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class CancellationInfoResponse {
    private CancellationStatus status;
    private UUID requestedBy;
    private Instant requestedAt;
    private String reason;
    private UUID decidedBy;
    private Instant decidedAt;
    private String adminNotes;
    private RefundInfoResponse refundInfo;
}
