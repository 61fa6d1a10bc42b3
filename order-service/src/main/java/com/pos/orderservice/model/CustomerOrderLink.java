package com.pos.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Link between a customer and one of their orders.
 * Rows are written with an idempotent native insert, see CustomerOrderLinkRepository.
 */
@Entity
@Table(name = "customer_orders")
@IdClass(CustomerOrderLink.Key.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerOrderLink {

    @Id
    @Column(name = "customer_id")
    private UUID customerId;

    @Id
    @Column(name = "order_id")
    private UUID orderId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private UUID customerId;
        private UUID orderId;
    }
}
