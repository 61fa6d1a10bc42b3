package com.pos.orderservice.service;

import com.pos.orderservice.model.CancellationStatus;
import com.pos.orderservice.model.Order;
import com.pos.orderservice.model.PaymentMethod;
import com.pos.orderservice.model.PaymentStatus;
import com.pos.orderservice.repository.OrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CustomerEffectsApplierTest {

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private CustomerLedger customerLedger;

    @InjectMocks
    private CustomerEffectsApplier applier;

    private UUID customerId;
    private Order order;

    @BeforeEach
    void setUp() {
        customerId = UUID.randomUUID();
        order = new Order();
        order.setId(UUID.randomUUID());
        order.setCustomerId(customerId);
        order.setTotal(new BigDecimal("359"));
        order.setPaymentMethod(PaymentMethod.CASH);
        order.setLoyaltyPointsEarned(35);

        lenient().when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));
    }

    @Test
    void apply_CashOrder_RecordsStatsAndMarksApplied() {
        assertThat(applier.apply(order.getId())).isTrue();

        verify(customerLedger).recordOrder(customerId, order.getId(), new BigDecimal("359"), 35);
        verify(customerLedger, never()).debitLoyaltyPoints(any(), anyInt());
        assertThat(order.isCustomerEffectsApplied()).isTrue();
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        verify(orderRepository).saveAndFlush(order);
    }

    @Test
    void apply_LoyaltyOrder_CreditsEarnedThenDebitsCost() {
        order.setPaymentMethod(PaymentMethod.LOYALTY);
        order.setLoyaltyPointsRedeemed(359);
        when(customerLedger.debitLoyaltyPoints(customerId, 359)).thenReturn(true);

        applier.apply(order.getId());

        InOrder inOrder = inOrder(customerLedger);
        inOrder.verify(customerLedger).recordOrder(customerId, order.getId(), new BigDecimal("359"), 35);
        inOrder.verify(customerLedger).debitLoyaltyPoints(customerId, 359);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
    }

    @Test
    void apply_LoyaltyDebitRejected_MarksPaymentFailed() {
        order.setPaymentMethod(PaymentMethod.LOYALTY);
        order.setLoyaltyPointsRedeemed(359);
        when(customerLedger.debitLoyaltyPoints(customerId, 359)).thenReturn(false);

        applier.apply(order.getId());

        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(order.isCustomerEffectsApplied()).isTrue();
    }

    @Test
    void apply_LoyaltyOrderCancelledBeforeReplay_NeverTakesPoints() {
        order.setPaymentMethod(PaymentMethod.LOYALTY);
        order.setLoyaltyPointsRedeemed(359);
        order.getCancellation().setStatus(CancellationStatus.REQUESTED);
        order.getCancellation().setRefundInfo(CancellationServiceImpl.snapshotRefund(order));
        order.getCancellation().setStatus(CancellationStatus.APPROVED);

        assertThat(applier.apply(order.getId())).isTrue();

        assertThat(order.getCancellation().getRefundInfo().getLoyaltyPointsToRefund()).isZero();
        verify(customerLedger, never()).debitLoyaltyPoints(any(), anyInt());
        verify(customerLedger).recordOrder(customerId, order.getId(), new BigDecimal("359"), 35);
        assertThat(order.getPaymentStatus()).isNotEqualTo(PaymentStatus.PAID);
        assertThat(order.isCustomerEffectsApplied()).isTrue();
    }

    @Test
    void apply_AlreadyApplied_DoesNothing() {
        order.setCustomerEffectsApplied(true);

        assertThat(applier.apply(order.getId())).isFalse();

        verifyNoInteractions(customerLedger);
        verify(orderRepository, never()).saveAndFlush(any());
    }

    @Test
    void apply_WalkInOrder_DoesNothing() {
        order.setCustomerId(null);

        assertThat(applier.apply(order.getId())).isFalse();

        verifyNoInteractions(customerLedger);
    }
}
