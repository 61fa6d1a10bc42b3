package com.pos.orderservice.job;

import com.pos.orderservice.config.ReconciliationProperties;
import com.pos.orderservice.model.Order;
import com.pos.orderservice.repository.OrderRepository;
import com.pos.orderservice.service.CustomerEffectsApplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Replays customer effects for committed orders whose post-commit step never landed.
 * The order ledger is the source of truth; customer stats follow it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomerStatsReconciler {

    private final OrderRepository orderRepository;
    private final CustomerEffectsApplier customerEffectsApplier;
    private final ReconciliationProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${pos.reconciliation.fixed-delay-ms:60000}")
    public void reconcile() {
        Instant cutoff = clock.instant().minus(properties.getGracePeriod());
        List<Order> pending = orderRepository.findPendingCustomerEffects(cutoff,
                PageRequest.of(0, properties.getBatchSize()));

        if (pending.isEmpty()) {
            return;
        }

        log.info("Reconciling customer effects. pendingOrders={}", pending.size());

        int applied = 0;
        for (Order order : pending) {
            try {
                if (customerEffectsApplier.apply(order.getId())) {
                    applied++;
                }
            } catch (Exception e) {
                // stays pending, next run picks it up again
                log.error("Customer effects replay failed. orderId={}, customerId={}",
                        order.getId(), order.getCustomerId(), e);
            }
        }

        log.info("Reconciliation completed. applied={}, pending={}", applied, pending.size() - applied);
    }
}
