package com.pos.orderservice.repository;

import com.pos.orderservice.model.OrderStatusHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OrderStatusHistoryRepository extends JpaRepository<OrderStatusHistory, Long> {

    // insertion order
    List<OrderStatusHistory> findByOrderIdOrderByIdAsc(UUID orderId);

    long countByOrderId(UUID orderId);
}
