package com.pos.orderservice.service;

import com.pos.common.exception.ResourceNotFoundException;
import com.pos.orderservice.config.AmqpConfig;
import com.pos.orderservice.dto.AddonSelectionRequest;
import com.pos.orderservice.dto.CreateOrderResponse;
import com.pos.orderservice.dto.CustomerSummary;
import com.pos.orderservice.dto.OrderItemRequest;
import com.pos.orderservice.dto.OrderQuoteResponse;
import com.pos.orderservice.dto.OrderRequest;
import com.pos.orderservice.dto.OrderResponse;
import com.pos.orderservice.exception.ErrorCode;
import com.pos.orderservice.exception.InsufficientLoyaltyPointsException;
import com.pos.orderservice.exception.InvalidOrderStateException;
import com.pos.orderservice.exception.ItemUnavailableException;
import com.pos.orderservice.exception.OrderValidationException;
import com.pos.orderservice.mapper.OrderMapper;
import com.pos.orderservice.model.AddonSelection;
import com.pos.orderservice.model.AddonSnapshot;
import com.pos.orderservice.model.Customer;
import com.pos.orderservice.model.MenuItemSnapshot;
import com.pos.orderservice.model.Order;
import com.pos.orderservice.model.OrderItem;
import com.pos.orderservice.model.PaymentMethod;
import com.pos.orderservice.model.PaymentStatus;
import com.pos.orderservice.pricing.AddonContribution;
import com.pos.orderservice.pricing.PriceBreakdown;
import com.pos.orderservice.pricing.PriceCalculator;
import com.pos.orderservice.pricing.SelectedAddon;
import com.pos.orderservice.repository.CustomerRepository;
import com.pos.orderservice.repository.MenuItemSnapshotRepository;
import com.pos.orderservice.repository.OrderRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    private final OrderRepository orderRepository;
    private final MenuItemSnapshotRepository menuItemSnapshotRepository;
    private final CustomerRepository customerRepository;
    private final PriceCalculator priceCalculator;
    private final CustomerLedger customerLedger;
    private final CustomerEffectsApplier customerEffectsApplier;
    private final OrderNumberGenerator orderNumberGenerator;
    private final OrderEventRecorder orderEventRecorder;
    private final OrderMapper orderMapper;
    private final TransactionTemplate transactionTemplate;

    /**
     * Not transactional itself: the order is committed first, the customer effects
     * run afterwards in their own transaction and may fail without touching the order.
     */
    @Override
    public CreateOrderResponse createOrder(OrderRequest orderRequest, Jwt jwt) {
        UUID actorId = UUID.fromString(jwt.getSubject());
        log.info("Order creation process started. actorId={}, lines={}, paymentMethod={}",
                actorId, orderRequest.getItems() == null ? 0 : orderRequest.getItems().size(),
                orderRequest.getPaymentMethod());

        validateLines(orderRequest.getItems());

        PlacedOrder placed = transactionTemplate.execute(status -> placeOrder(orderRequest, actorId));
        UUID orderId = placed.getOrderId();
        log.info("Order committed. orderId={}, orderNumber={}", orderId, placed.getOrderNumber());

        if (placed.getCustomerId() != null) {
            try {
                customerEffectsApplier.apply(orderId);
            } catch (Exception e) {
                // the order stands; CustomerStatsReconciler replays the effects later
                log.error("Customer effects failed after order commit. orderId={}, customerId={}",
                        orderId, placed.getCustomerId(), e);
            }
        }

        return transactionTemplate.execute(status -> {
            Order order = findOrderOrThrow(orderId);
            CustomerSummary customer = placed.getCustomerId() == null ? null
                    : customerRepository.findById(placed.getCustomerId())
                    .map(c -> orderMapper.toCustomerSummary(c, placed.isNewCustomer()))
                    .orElse(null);
            return CreateOrderResponse.builder()
                    .order(orderMapper.toOrderResponse(order))
                    .customer(customer)
                    .build();
        });
    }

    @Override
    @Transactional(readOnly = true)
    public OrderQuoteResponse quoteOrder(List<OrderItemRequest> items) {
        validateLines(items);
        List<PricedLine> lines = priceLines(items);
        BigDecimal subtotal = sumLineTotals(lines);

        List<OrderQuoteResponse.Line> quoteLines = lines.stream()
                .map(line -> OrderQuoteResponse.Line.builder()
                        .menuItemId(line.getMenuItem().getMenuItemId())
                        .itemName(line.getMenuItem().getName())
                        .quantity(line.getRequest().getQuantity())
                        .unitPrice(line.getUnitPrice())
                        .lineTotal(line.getLineTotal())
                        .priceOverridden(line.isPriceOverridden())
                        .breakdown(line.getBreakdown())
                        .build())
                .collect(Collectors.toList());

        return OrderQuoteResponse.builder()
                .lines(quoteLines)
                .subtotal(subtotal)
                .tax(BigDecimal.ZERO)
                .total(subtotal)
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrder(UUID orderId) {
        return orderMapper.toOrderResponse(findOrderOrThrow(orderId));
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrderByNumber(String orderNumber) {
        Order order = orderRepository.findByOrderNumber(orderNumber)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderNumber,
                        ErrorCode.ORDER_NOT_FOUND.name()));
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getCustomerOrders(UUID customerId) {
        if (!customerRepository.existsById(customerId)) {
            throw new ResourceNotFoundException("Customer not found: " + customerId,
                    ErrorCode.CUSTOMER_NOT_FOUND.name());
        }
        return orderMapper.toOrderResponses(orderRepository.findByCustomerIdOrderByCreatedAtDesc(customerId));
    }

    @Override
    @Transactional
    public OrderResponse updatePaymentStatus(UUID orderId, PaymentStatus paymentStatus, Jwt jwt) {
        Order order = findOrderOrThrow(orderId);
        PaymentStatus previous = order.getPaymentStatus();

        // for loyalty orders the status records the outcome of the points debit
        if (order.getPaymentMethod() == PaymentMethod.LOYALTY) {
            log.warn("Manual payment status change refused on loyalty order. orderId={}, status={}",
                    orderId, previous);
            throw new InvalidOrderStateException(ErrorCode.PAYMENT_STATUS_MANAGED,
                    "Payment status of loyalty order " + order.getOrderNumber() + " cannot be changed manually");
        }

        order.setPaymentStatus(paymentStatus);
        Order saved = orderRepository.save(order);

        log.info("Payment status updated. orderId={}, from={}, to={}, actorId={}",
                orderId, previous, paymentStatus, jwt.getSubject());
        return orderMapper.toOrderResponse(saved);
    }

    // Steps 1-4 of order creation, all inside one transaction
    private PlacedOrder placeOrder(OrderRequest orderRequest, UUID actorId) {
        Optional<CustomerResolution> resolution = customerLedger.resolveCustomer(
                orderRequest.getCustomerPhone(), orderRequest.getCustomerEmail(), orderRequest.getCustomerName());
        Customer customer = resolution.map(CustomerResolution::getCustomer).orElse(null);

        List<PricedLine> lines = priceLines(orderRequest.getItems());
        BigDecimal subtotal = sumLineTotals(lines);
        BigDecimal total = subtotal; // no tax

        int pointsRedeemed = 0;
        if (orderRequest.getPaymentMethod() == PaymentMethod.LOYALTY) {
            pointsRedeemed = checkLoyaltyBalance(customer, total);
        }

        Order order = new Order();
        order.setOrderNumber(orderNumberGenerator.nextOrderNumber());
        order.setCustomerId(customer == null ? null : customer.getId());
        order.setCustomerName(firstNonBlank(orderRequest.getCustomerName(),
                customer == null ? null : customer.getDisplayName()));
        order.setCustomerPhone(firstNonBlank(orderRequest.getCustomerPhone(),
                customer == null ? null : customer.getPhone()));
        order.setSubtotal(subtotal);
        order.setTax(BigDecimal.ZERO);
        order.setTotal(total);
        order.setPaymentMethod(orderRequest.getPaymentMethod());
        order.setPaymentStatus(PaymentStatus.PENDING);
        order.setLoyaltyPointsRedeemed(pointsRedeemed);
        order.setLoyaltyPointsEarned(customer == null ? 0 : customerLedger.pointsEarnedFor(total));
        order.setNotes(orderRequest.getNotes());
        order.setLocationId(orderRequest.getLocationId());
        order.setCreatedBy(actorId);

        lines.forEach(line -> order.addItem(toOrderItem(line)));

        Order savedOrder = orderRepository.save(order);
        log.info("Order saved to database. orderId={}, orderNumber={}, total={}",
                savedOrder.getId(), savedOrder.getOrderNumber(), savedOrder.getTotal());

        orderEventRecorder.record(AmqpConfig.ROUTING_KEY_ORDER_CREATED, savedOrder, actorId, null);

        return new PlacedOrder(savedOrder.getId(), savedOrder.getOrderNumber(), savedOrder.getCustomerId(),
                resolution.map(CustomerResolution::isNewCustomer).orElse(false));
    }

    private int checkLoyaltyBalance(Customer customer, BigDecimal total) {
        if (customer == null) {
            log.warn("Loyalty payment without a customer rejected");
            throw new InsufficientLoyaltyPointsException("Loyalty payment requires a customer phone or email");
        }
        int required = customerLedger.pointsRequiredFor(total);
        int balance = customer.getLoyaltyPoints() == null ? 0 : customer.getLoyaltyPoints();
        if (balance < required) {
            log.warn("Insufficient loyalty points. customerId={}, balance={}, required={}",
                    customer.getId(), balance, required);
            throw new InsufficientLoyaltyPointsException(
                    "Insufficient loyalty points: balance " + balance + ", required " + required);
        }
        return required;
    }

    private void validateLines(List<OrderItemRequest> items) {
        if (items == null || items.isEmpty()) {
            throw new OrderValidationException(ErrorCode.EMPTY_ORDER, "Order must contain at least one item");
        }
        for (OrderItemRequest item : items) {
            if (item.getCustomUnitPrice() != null && item.getCustomUnitPrice().signum() < 0) {
                throw new OrderValidationException(ErrorCode.INVALID_PRICE,
                        "Custom unit price must not be negative for menu item " + item.getMenuItemId());
            }
        }
    }

    private List<PricedLine> priceLines(List<OrderItemRequest> items) {
        Set<UUID> menuItemIds = items.stream()
                .map(OrderItemRequest::getMenuItemId)
                .collect(Collectors.toSet());

        // Fetch all menu items in single query to avoid N+1
        Map<UUID, MenuItemSnapshot> menuItems = menuItemSnapshotRepository.findAllById(menuItemIds).stream()
                .collect(Collectors.toMap(MenuItemSnapshot::getMenuItemId, Function.identity()));

        List<PricedLine> lines = new ArrayList<>();
        for (OrderItemRequest item : items) {
            MenuItemSnapshot menuItem = menuItems.get(item.getMenuItemId());
            if (menuItem == null) {
                log.warn("Menu item not found in local snapshot: menuItemId={}", item.getMenuItemId());
                throw new ResourceNotFoundException("Menu item not found: " + item.getMenuItemId(),
                        ErrorCode.ITEM_NOT_FOUND.name());
            }
            if (!menuItem.isAvailable()) {
                log.warn("Menu item not available: menuItemId={}, name={}", menuItem.getMenuItemId(), menuItem.getName());
                throw new ItemUnavailableException("Menu item is not available: " + menuItem.getName());
            }
            lines.add(priceLine(item, menuItem));
        }
        return lines;
    }

    private PricedLine priceLine(OrderItemRequest item, MenuItemSnapshot menuItem) {
        BigDecimal quantity = BigDecimal.valueOf(item.getQuantity());

        if (item.getCustomUnitPrice() != null) {
            BigDecimal unitPrice = item.getCustomUnitPrice();
            return new PricedLine(item, menuItem, null, unitPrice, unitPrice.multiply(quantity), true);
        }

        PriceBreakdown breakdown = priceCalculator.calculate(menuItem, item.getVariantIds(),
                toSelectedAddons(item.getAddonSelections()));
        BigDecimal unitPrice = breakdown.getTotalPrice();
        return new PricedLine(item, menuItem, breakdown, unitPrice, unitPrice.multiply(quantity), false);
    }

    private List<SelectedAddon> toSelectedAddons(List<AddonSelectionRequest> addons) {
        if (addons == null) {
            return List.of();
        }
        return addons.stream()
                .map(a -> new SelectedAddon(a.getAddonId(), a.getQuantity() == null ? 0 : a.getQuantity()))
                .collect(Collectors.toList());
    }

    private OrderItem toOrderItem(PricedLine line) {
        OrderItemRequest request = line.getRequest();

        OrderItem item = new OrderItem();
        item.setMenuItemId(line.getMenuItem().getMenuItemId());
        item.setItemName(line.getMenuItem().getName());
        item.setQuantity(request.getQuantity());
        item.setUnitPrice(line.getUnitPrice());
        item.setTotalPrice(line.getLineTotal());
        item.setPriceOverridden(line.isPriceOverridden());
        item.setSpecialInstructions(request.getSpecialInstructions());
        item.setVariantIds(request.getVariantIds() == null ? new ArrayList<>() : new ArrayList<>(request.getVariantIds()));
        item.setAddonSelections(toAddonSelections(line));
        return item;
    }

    private List<AddonSelection> toAddonSelections(PricedLine line) {
        if (line.getBreakdown() != null) {
            List<AddonSelection> selections = new ArrayList<>();
            for (AddonContribution addon : line.getBreakdown().getAddonContributions()) {
                selections.add(new AddonSelection(addon.getAddonId(), addon.getName(), addon.getQuantity(),
                        addon.getUnitPrice()));
            }
            return selections;
        }

        // overridden price: keep what was selected for the kitchen, without prices
        List<AddonSelectionRequest> requested = line.getRequest().getAddonSelections();
        if (requested == null) {
            return new ArrayList<>();
        }
        return requested.stream()
                .map(a -> new AddonSelection(a.getAddonId(),
                        line.getMenuItem().findAddon(a.getAddonId()).map(AddonSnapshot::getName).orElse(null),
                        a.getQuantity() == null ? 0 : a.getQuantity(),
                        null))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private BigDecimal sumLineTotals(List<PricedLine> lines) {
        return lines.stream()
                .map(PricedLine::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private Order findOrderOrThrow(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId,
                        ErrorCode.ORDER_NOT_FOUND.name()));
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        return second;
    }

    @Getter
    @AllArgsConstructor
    private static class PricedLine {
        private final OrderItemRequest request;
        private final MenuItemSnapshot menuItem;
        private final PriceBreakdown breakdown; // null when the price was overridden
        private final BigDecimal unitPrice;
        private final BigDecimal lineTotal;
        private final boolean priceOverridden;
    }

    @Getter
    @AllArgsConstructor
    private static class PlacedOrder {
        private final UUID orderId;
        private final String orderNumber;
        private final UUID customerId;
        private final boolean newCustomer;
    }
}
