package com.pos.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_customer_id", columnList = "customer_id"),
        @Index(name = "idx_orders_cancellation_status", columnList = "cancellation_status")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    // ORD-YYYYMMDD-#### printed on receipts
    @Column(name = "order_number", nullable = false, unique = true, updatable = false)
    @ToString.Include
    private String orderNumber;

    // Nullable for walk-in orders without customer details
    @Column(name = "customer_id")
    private UUID customerId;

    // Denormalized for receipts, as entered at checkout
    private String customerName;
    private String customerPhone;

    // When order is deleted, delete all associated lines (CascadeType.ALL)
    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    private List<OrderItem> items = new ArrayList<>();

    @Column(nullable = false)
    private BigDecimal subtotal;

    // Always zero: no tax is charged
    @Column(nullable = false)
    private BigDecimal tax = BigDecimal.ZERO;

    @Column(nullable = false)
    private BigDecimal total;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentStatus paymentStatus = PaymentStatus.PENDING;

    // Points charged for a LOYALTY payment, 0 otherwise
    @Column(nullable = false)
    private int loyaltyPointsRedeemed;

    // Points credited to the customer for this order
    @Column(nullable = false)
    private int loyaltyPointsEarned;

    // Set once the customer stats/loyalty side effects have been committed
    @Column(nullable = false)
    private boolean customerEffectsApplied;

    @Column(length = 1000)
    private String notes;

    private UUID locationId;

    // Staff user who rang up the order
    @Column(nullable = false, updatable = false)
    private UUID createdBy;

    @Embedded
    private CancellationRecord cancellation = new CancellationRecord();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Optimistic locking: two admins deciding the same cancellation
    // cannot both win, the second flush fails
    @Version
    @Column(name = "version")
    private Long version;

    public void addItem(OrderItem item) {
        item.setOrder(this);
        item.setLineNumber(items.size() + 1);
        items.add(item);
    }

    public CancellationStatus getCancellationStatus() {
        return cancellation == null ? CancellationStatus.NONE : cancellation.getStatus();
    }
}
