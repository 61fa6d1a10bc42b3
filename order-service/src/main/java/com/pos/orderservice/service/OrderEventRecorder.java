package com.pos.orderservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pos.common.contracts.OrderActivityContract;
import com.pos.orderservice.model.Order;
import com.pos.orderservice.model.OutboxEvent;
import com.pos.orderservice.model.RefundInfo;
import com.pos.orderservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Writes order activity events to the outbox in the caller's transaction.
 * {@link com.pos.orderservice.job.OutboxPublisher} ships them to RabbitMQ after commit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderEventRecorder {

    private static final String AGGREGATE_TYPE = "ORDER";

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(String routingKey, Order order, UUID actorId, String reason) {
        RefundInfo refund = order.getCancellation() == null ? null : order.getCancellation().getRefundInfo();

        OrderActivityContract contract = OrderActivityContract.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .customerId(order.getCustomerId())
                .actorId(actorId)
                .total(order.getTotal())
                .paymentMethod(order.getPaymentMethod().name())
                .cancellationStatus(order.getCancellationStatus().name())
                .reason(reason)
                .refundAmount(refund == null ? null : refund.getAmount())
                .refundLoyaltyPoints(refund == null ? null : refund.getLoyaltyPointsToRefund())
                .occurredAt(clock.instant())
                .build();

        String payload;
        try {
            payload = objectMapper.writeValueAsString(contract);
        } catch (JsonProcessingException e) {
            // Aborts the surrounding transaction, the state change must not commit without its event
            throw new IllegalStateException("Failed to serialize outbox event " + routingKey, e);
        }

        outboxRepository.save(OutboxEvent.builder()
                .aggregateType(AGGREGATE_TYPE)
                .aggregateId(order.getId().toString())
                .type(routingKey)
                .payload(payload)
                .createdAt(LocalDateTime.now(clock))
                .processed(false)
                .build());

        log.info("'{}' event saved to Outbox. orderId={}", routingKey, order.getId());
    }
}
