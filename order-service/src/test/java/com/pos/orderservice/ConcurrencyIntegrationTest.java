package com.pos.orderservice;

import com.pos.orderservice.dto.AddonSelectionRequest;
import com.pos.orderservice.dto.CreateOrderResponse;
import com.pos.orderservice.dto.OrderItemRequest;
import com.pos.orderservice.dto.OrderRequest;
import com.pos.orderservice.exception.InvalidOrderStateException;
import com.pos.orderservice.model.CancellationStatus;
import com.pos.orderservice.model.Customer;
import com.pos.orderservice.model.Order;
import com.pos.orderservice.model.PaymentMethod;
import com.pos.orderservice.repository.CustomerRepository;
import com.pos.orderservice.repository.MenuItemSnapshotRepository;
import com.pos.orderservice.repository.OrderRepository;
import com.pos.orderservice.repository.OrderStatusHistoryRepository;
import com.pos.orderservice.service.CancellationService;
import com.pos.orderservice.service.OrderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyIntegrationTest extends AbstractIntegrationTest {

    private static final String PHONE = "9123456780";

    @Autowired
    private OrderService orderService;

    @Autowired
    private CancellationService cancellationService;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private OrderStatusHistoryRepository statusHistoryRepository;

    @Autowired
    private MenuItemSnapshotRepository menuItemSnapshotRepository;

    private UUID customerId;

    @BeforeEach
    void setUp() {
        menuItemSnapshotRepository.save(IntegrationFixtures.buddhaBowl());
        customerId = customerRepository.save(Customer.builder()
                .phone(PHONE)
                .firstName("Meera")
                .loyaltyPoints(1000)
                .build()).getId();
    }

    @Test
    void should_count_every_concurrent_order_and_number_them_uniquely() throws Exception {
        int threads = 10;
        List<CreateOrderResponse> responses = runConcurrently(threads,
                () -> orderService.createOrder(bowlOrder(PaymentMethod.CASH), staff()));

        List<String> numbers = responses.stream()
                .map(r -> r.getOrder().getOrderNumber())
                .sorted()
                .collect(Collectors.toList());
        assertThat(numbers).doesNotHaveDuplicates();
        assertThat(numbers).extracting(n -> n.substring(n.length() - 4))
                .containsExactlyElementsOf(IntStream.rangeClosed(1, threads)
                        .mapToObj(i -> String.format("%04d", i))
                        .collect(Collectors.toList()));

        Customer customer = customerRepository.findById(customerId).orElseThrow();
        assertThat(customer.getTotalOrders()).isEqualTo(threads);
        assertThat(customer.getTotalSpent()).isEqualByComparingTo("3590");
        assertThat(customer.getLoyaltyPoints()).isEqualTo(1000 + threads * 35);
    }

    @Test
    void should_let_only_one_of_two_concurrent_approvals_win() throws Exception {
        UUID orderId = orderService.createOrder(bowlOrder(PaymentMethod.LOYALTY), staff()).getOrder().getId();
        cancellationService.requestCancellation(orderId, "Customer left", staff());
        int balanceBeforeDecision = loyaltyBalance();

        List<Object> outcomes = runConcurrently(2, () -> {
            try {
                return cancellationService.approveCancellation(orderId, true, "approved", staff());
            } catch (InvalidOrderStateException e) {
                return e;
            }
        });

        assertThat(outcomes).filteredOn(o -> o instanceof InvalidOrderStateException).hasSize(1);
        assertThat(loyaltyBalance()).isEqualTo(balanceBeforeDecision + 359);
        assertThat(statusHistoryRepository.countByOrderId(orderId)).isEqualTo(2);
        assertThat(orderRepository.findById(orderId).orElseThrow().getCancellationStatus())
                .isEqualTo(CancellationStatus.APPROVED);
    }

    @Test
    void should_prevent_lost_updates_using_optimistic_locking() {
        UUID orderId = orderService.createOrder(bowlOrder(PaymentMethod.CASH), staff()).getOrder().getId();

        Order firstView = orderRepository.findById(orderId).orElseThrow();
        Order secondView = orderRepository.findById(orderId).orElseThrow();
        assertThat(firstView.getVersion()).isEqualTo(secondView.getVersion());

        firstView.getCancellation().setStatus(CancellationStatus.REQUESTED);
        orderRepository.saveAndFlush(firstView);

        secondView.getCancellation().setStatus(CancellationStatus.REJECTED);
        assertThatThrownBy(() -> orderRepository.saveAndFlush(secondView))
                .isInstanceOf(ObjectOptimisticLockingFailureException.class);

        assertThat(orderRepository.findById(orderId).orElseThrow().getCancellationStatus())
                .isEqualTo(CancellationStatus.REQUESTED);
    }

    private int loyaltyBalance() {
        return customerRepository.findById(customerId).orElseThrow().getLoyaltyPoints();
    }

    // Releases all tasks at once so they overlap inside the database
    private <T> List<T> runConcurrently(int count, Callable<T> task) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(count);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();

            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                try {
                    results.add(future.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    throw new AssertionError("Concurrent task failed", e.getCause());
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static Jwt staff() {
        return Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject(UUID.randomUUID().toString())
                .build();
    }

    private static OrderRequest bowlOrder(PaymentMethod paymentMethod) {
        OrderItemRequest line = new OrderItemRequest();
        line.setMenuItemId(IntegrationFixtures.BOWL_ID);
        line.setQuantity(1);
        line.setVariantIds(List.of(IntegrationFixtures.LARGE_ID));
        line.setAddonSelections(List.of(new AddonSelectionRequest(IntegrationFixtures.PANEER_ID, 2)));

        OrderRequest request = new OrderRequest();
        request.setCustomerPhone(PHONE);
        request.setPaymentMethod(paymentMethod);
        request.setItems(List.of(line));
        return request;
    }
}
