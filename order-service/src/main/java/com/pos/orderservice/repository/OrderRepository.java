package com.pos.orderservice.repository;

import com.pos.orderservice.model.CancellationStatus;
import com.pos.orderservice.model.Order;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    Optional<Order> findByOrderNumber(String orderNumber);

    // newest first, for the customer profile
    List<Order> findByCustomerIdOrderByCreatedAtDesc(UUID customerId);

    // admin triage queue, oldest request first
    @Query("SELECT o FROM Order o WHERE o.cancellation.status = :status " +
            "ORDER BY o.cancellation.requestedAt ASC, o.createdAt ASC")
    List<Order> findByCancellationStatusOldestRequestFirst(@Param("status") CancellationStatus status);

    // orders whose post-commit customer effects never landed
    @Query("SELECT o FROM Order o WHERE o.customerId IS NOT NULL " +
            "AND o.customerEffectsApplied = false AND o.createdAt < :cutoff ORDER BY o.createdAt ASC")
    List<Order> findPendingCustomerEffects(@Param("cutoff") Instant cutoff, Pageable pageable);
}
