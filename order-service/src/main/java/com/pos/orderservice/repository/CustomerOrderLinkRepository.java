package com.pos.orderservice.repository;

import com.pos.orderservice.model.CustomerOrderLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CustomerOrderLinkRepository extends JpaRepository<CustomerOrderLink, CustomerOrderLink.Key> {

    // Re-linking the same pair is a no-op (reconciliation may replay it)
    @Modifying
    @Query(value = "INSERT INTO customer_orders (customer_id, order_id, created_at) " +
            "VALUES (:customerId, :orderId, now()) " +
            "ON CONFLICT (customer_id, order_id) DO NOTHING", nativeQuery = true)
    int linkIfAbsent(@Param("customerId") UUID customerId, @Param("orderId") UUID orderId);

    boolean existsByCustomerIdAndOrderId(UUID customerId, UUID orderId);
}
