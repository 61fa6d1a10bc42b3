package com.pos.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit row, one per cancellation transition.
 */
@Entity
@Immutable
@Table(name = "order_status_history", indexes = {
        @Index(name = "idx_status_history_order_id", columnList = "order_id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusHistory {

    // Identity values grow with insertion order, which is what readers sort on
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private UUID orderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private CancellationStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private CancellationStatus newStatus;

    @Column(length = 500, updatable = false)
    private String reason;

    @Column(nullable = false, updatable = false)
    private UUID changedBy;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
