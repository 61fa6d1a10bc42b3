package com.pos.orderservice.service;

import com.pos.common.exception.ResourceNotFoundException;
import com.pos.orderservice.exception.ErrorCode;
import com.pos.orderservice.model.CancellationStatus;
import com.pos.orderservice.model.Order;
import com.pos.orderservice.model.PaymentMethod;
import com.pos.orderservice.model.PaymentStatus;
import com.pos.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Applies the customer side of a committed order: link, stats, earned points and,
 * for loyalty payments, the points debit.
 *
 * Runs in its own transaction after the order itself has committed. The order's
 * {@code customerEffectsApplied} flag is set in that same transaction, so the
 * reconciler can replay whatever did not land.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerEffectsApplier {

    private final OrderRepository orderRepository;
    private final CustomerLedger customerLedger;

    /**
     * @return true when effects were applied by this call, false when there was nothing to do
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean apply(UUID orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId,
                        ErrorCode.ORDER_NOT_FOUND.name()));

        if (order.getCustomerId() == null || order.isCustomerEffectsApplied()) {
            return false;
        }

        UUID customerId = order.getCustomerId();

        // earned points first, then the loyalty charge
        customerLedger.recordOrder(customerId, order.getId(), order.getTotal(), order.getLoyaltyPointsEarned());

        boolean loyaltyDue = order.getPaymentMethod() == PaymentMethod.LOYALTY
                && order.getPaymentStatus() == PaymentStatus.PENDING;

        if (loyaltyDue && order.getCancellationStatus() != CancellationStatus.NONE) {
            // the refund was snapshotted without these points, so they are never taken
            log.warn("Loyalty debit skipped, order is already in cancellation. orderId={}, cancellationStatus={}",
                    order.getId(), order.getCancellationStatus());
        } else if (loyaltyDue) {
            boolean debited = customerLedger.debitLoyaltyPoints(customerId, order.getLoyaltyPointsRedeemed());
            order.setPaymentStatus(debited ? PaymentStatus.PAID : PaymentStatus.FAILED);
            if (!debited) {
                log.warn("Loyalty payment failed after order commit. orderId={}, customerId={}, points={}",
                        order.getId(), customerId, order.getLoyaltyPointsRedeemed());
            }
        }

        order.setCustomerEffectsApplied(true);
        // version check: a concurrent replay of the same order loses here and rolls back
        orderRepository.saveAndFlush(order);

        log.info("Customer effects applied. orderId={}, customerId={}, paymentStatus={}",
                order.getId(), customerId, order.getPaymentStatus());
        return true;
    }
}
