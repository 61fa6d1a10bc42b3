package com.pos.orderservice.service;

import com.pos.common.exception.ResourceNotFoundException;
import com.pos.orderservice.config.AmqpConfig;
import com.pos.orderservice.dto.CancellationResponse;
import com.pos.orderservice.dto.OrderResponse;
import com.pos.orderservice.dto.StatusHistoryResponse;
import com.pos.orderservice.exception.ErrorCode;
import com.pos.orderservice.exception.InvalidOrderStateException;
import com.pos.orderservice.exception.OrderValidationException;
import com.pos.orderservice.mapper.OrderMapper;
import com.pos.orderservice.model.CancellationRecord;
import com.pos.orderservice.model.CancellationStatus;
import com.pos.orderservice.model.Order;
import com.pos.orderservice.model.OrderStatusHistory;
import com.pos.orderservice.model.PaymentMethod;
import com.pos.orderservice.model.PaymentStatus;
import com.pos.orderservice.model.RefundInfo;
import com.pos.orderservice.repository.OrderRepository;
import com.pos.orderservice.repository.OrderStatusHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class CancellationServiceImpl implements CancellationService {

    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository statusHistoryRepository;
    private final CustomerLedger customerLedger;
    private final OrderEventRecorder orderEventRecorder;
    private final OrderMapper orderMapper;
    private final Clock clock;

    @Override
    @Transactional
    public CancellationResponse requestCancellation(UUID orderId, String reason, Jwt jwt) {
        if (reason == null || reason.isBlank()) {
            throw new OrderValidationException(ErrorCode.EMPTY_REASON, "Cancellation reason is required");
        }
        UUID actorId = UUID.fromString(jwt.getSubject());
        log.info("Cancellation requested. orderId={}, actorId={}", orderId, actorId);

        Order order = findOrderOrThrow(orderId);
        CancellationStatus current = order.getCancellationStatus();

        if (!current.canTransitionTo(CancellationStatus.REQUESTED)) {
            log.warn("Cancellation request rejected, already requested or decided. orderId={}, status={}",
                    orderId, current);
            throw new InvalidOrderStateException(ErrorCode.ALREADY_REQUESTED_OR_DECIDED,
                    "Cancellation already " + current.name().toLowerCase() + " for order " + order.getOrderNumber());
        }

        // the points debit has not landed yet, a refund promised now would not match it
        if (order.getPaymentMethod() == PaymentMethod.LOYALTY && !order.isCustomerEffectsApplied()) {
            log.warn("Cancellation request rejected, loyalty payment not settled. orderId={}, paymentStatus={}",
                    orderId, order.getPaymentStatus());
            throw new InvalidOrderStateException(ErrorCode.LOYALTY_PAYMENT_NOT_SETTLED,
                    "Loyalty payment for order " + order.getOrderNumber() + " is still being settled, try again shortly");
        }

        CancellationRecord cancellation = cancellationOf(order);
        cancellation.setStatus(CancellationStatus.REQUESTED);
        cancellation.setRequestedBy(actorId);
        cancellation.setRequestedAt(clock.instant());
        cancellation.setReason(reason.trim());
        cancellation.setRefundInfo(snapshotRefund(order));

        Order saved = flushTransition(order);
        appendHistory(saved, current, CancellationStatus.REQUESTED, cancellation.getReason(), actorId);
        orderEventRecorder.record(AmqpConfig.ROUTING_KEY_CANCELLATION_REQUESTED, saved, actorId,
                cancellation.getReason());

        log.info("Cancellation request saved. orderId={}, refundAmount={}, refundPoints={}", orderId,
                cancellation.getRefundInfo().getAmount(), cancellation.getRefundInfo().getLoyaltyPointsToRefund());

        return CancellationResponse.builder()
                .order(orderMapper.toOrderResponse(saved))
                .refundInfo(orderMapper.toRefundInfoResponse(cancellation.getRefundInfo()))
                .build();
    }

    @Override
    @Transactional
    public CancellationResponse approveCancellation(UUID orderId, boolean approved, String adminNotes, Jwt jwt) {
        UUID actorId = UUID.fromString(jwt.getSubject());
        CancellationStatus next = approved ? CancellationStatus.APPROVED : CancellationStatus.REJECTED;
        log.info("Cancellation decision received. orderId={}, decision={}, actorId={}", orderId, next, actorId);

        Order order = findOrderOrThrow(orderId);
        CancellationStatus current = order.getCancellationStatus();

        if (!current.canTransitionTo(next)) {
            log.warn("Cancellation decision rejected, order is not awaiting a decision. orderId={}, status={}",
                    orderId, current);
            throw new InvalidOrderStateException(ErrorCode.NOT_IN_REQUESTED_STATE,
                    "Order " + order.getOrderNumber() + " has no pending cancellation request");
        }

        CancellationRecord cancellation = cancellationOf(order);
        cancellation.setStatus(next);
        cancellation.setDecidedBy(actorId);
        cancellation.setDecidedAt(clock.instant());
        cancellation.setAdminNotes(adminNotes);

        // The status change must win the version check before any refund is applied
        Order saved = flushTransition(order);

        RefundInfo refund = cancellation.getRefundInfo();
        if (approved && refund != null && refund.refundsLoyaltyPoints()) {
            if (saved.getCustomerId() == null) {
                throw new IllegalStateException("Loyalty refund without a customer on order " + orderId);
            }
            customerLedger.creditLoyaltyPoints(saved.getCustomerId(), refund.getLoyaltyPointsToRefund());
        }

        appendHistory(saved, current, next, adminNotes, actorId);
        orderEventRecorder.record(approved
                        ? AmqpConfig.ROUTING_KEY_CANCELLATION_APPROVED
                        : AmqpConfig.ROUTING_KEY_CANCELLATION_REJECTED,
                saved, actorId, adminNotes);

        log.info("Cancellation {}. orderId={}, refundMethod={}, refundPoints={}", next, orderId,
                refund == null ? null : refund.getPaymentMethod(),
                approved && refund != null ? refund.getLoyaltyPointsToRefund() : 0);

        return CancellationResponse.builder()
                .order(orderMapper.toOrderResponse(saved))
                .refundInfo(approved ? orderMapper.toRefundInfoResponse(refund) : null)
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getCancellationRequests() {
        return orderMapper.toOrderResponses(
                orderRepository.findByCancellationStatusOldestRequestFirst(CancellationStatus.REQUESTED));
    }

    @Override
    @Transactional(readOnly = true)
    public List<StatusHistoryResponse> getOrderStatusHistory(UUID orderId) {
        if (!orderRepository.existsById(orderId)) {
            throw new ResourceNotFoundException("Order not found: " + orderId, ErrorCode.ORDER_NOT_FOUND.name());
        }
        return orderMapper.toStatusHistoryResponses(statusHistoryRepository.findByOrderIdOrderByIdAsc(orderId));
    }

    /**
     * Refund promised at request time. Loyalty points are only returned when the
     * order's loyalty debit actually went through.
     */
    static RefundInfo snapshotRefund(Order order) {
        boolean loyaltyCaptured = order.getPaymentMethod() == PaymentMethod.LOYALTY
                && order.getPaymentStatus() == PaymentStatus.PAID;

        return RefundInfo.builder()
                .paymentMethod(order.getPaymentMethod())
                .amount(order.getTotal())
                .loyaltyPointsToRefund(loyaltyCaptured ? order.getLoyaltyPointsRedeemed() : 0)
                .build();
    }

    private Order flushTransition(Order order) {
        try {
            return orderRepository.saveAndFlush(order);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent cancellation transition lost. orderId={}", order.getId());
            throw new InvalidOrderStateException(ErrorCode.CONCURRENT_MODIFICATION,
                    "Order " + order.getId() + " was changed by another user, reload and try again", e);
        }
    }

    private void appendHistory(Order order, CancellationStatus previous, CancellationStatus next,
                               String reason, UUID actorId) {
        statusHistoryRepository.save(OrderStatusHistory.builder()
                .orderId(order.getId())
                .previousStatus(previous)
                .newStatus(next)
                .reason(reason)
                .changedBy(actorId)
                .build());
    }

    private CancellationRecord cancellationOf(Order order) {
        if (order.getCancellation() == null) {
            order.setCancellation(new CancellationRecord());
        }
        return order.getCancellation();
    }

    private Order findOrderOrThrow(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId,
                        ErrorCode.ORDER_NOT_FOUND.name()));
    }
}
