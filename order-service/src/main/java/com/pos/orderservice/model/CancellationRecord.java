package com.pos.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Embeddable
public class CancellationRecord {

    @Enumerated(EnumType.STRING)
    @Column(name = "cancellation_status", nullable = false)
    private CancellationStatus status = CancellationStatus.NONE;

    // Set on request
    @Column(name = "cancellation_requested_by")
    private UUID requestedBy;

    @Column(name = "cancellation_requested_at")
    private Instant requestedAt;

    @Column(name = "cancellation_reason", length = 500)
    private String reason;

    // Set on decision (approve or reject)
    @Column(name = "cancellation_decided_by")
    private UUID decidedBy;

    @Column(name = "cancellation_decided_at")
    private Instant decidedAt;

    @Column(name = "cancellation_admin_notes", length = 500)
    private String adminNotes;

    @Embedded
    private RefundInfo refundInfo;
}
