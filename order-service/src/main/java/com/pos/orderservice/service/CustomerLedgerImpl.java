package com.pos.orderservice.service;

import com.pos.common.exception.ResourceNotFoundException;
import com.pos.orderservice.config.LoyaltyProperties;
import com.pos.orderservice.exception.ErrorCode;
import com.pos.orderservice.model.Customer;
import com.pos.orderservice.repository.CustomerOrderLinkRepository;
import com.pos.orderservice.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerLedgerImpl implements CustomerLedger {

    static final String DEFAULT_FIRST_NAME = "Customer";

    private final CustomerRepository customerRepository;
    private final CustomerOrderLinkRepository linkRepository;
    private final LoyaltyProperties loyaltyProperties;

    @Override
    @Transactional
    public Optional<CustomerResolution> resolveCustomer(String phone, String email, String name) {
        String normalizedPhone = trimToNull(phone);
        String normalizedEmail = trimToNull(email);

        if (normalizedPhone == null && normalizedEmail == null) {
            return Optional.empty();
        }

        Optional<Customer> existing = Optional.empty();
        if (normalizedPhone != null) {
            existing = customerRepository.findByPhoneAndIsActiveTrue(normalizedPhone);
        }
        if (existing.isEmpty() && normalizedEmail != null) {
            existing = customerRepository.findByEmailAndIsActiveTrue(normalizedEmail);
        }

        if (existing.isPresent()) {
            log.debug("Existing customer resolved. customerId={}", existing.get().getId());
            return Optional.of(new CustomerResolution(existing.get(), false));
        }

        String[] nameParts = splitName(name);
        Customer customer = Customer.builder()
                .phone(normalizedPhone)
                .email(normalizedEmail)
                .firstName(nameParts[0])
                .lastName(nameParts[1])
                .build();

        Customer saved = customerRepository.save(customer);
        log.info("New customer created at checkout. customerId={}", saved.getId());
        return Optional.of(new CustomerResolution(saved, true));
    }

    @Override
    public int pointsEarnedFor(BigDecimal orderTotal) {
        if (orderTotal == null || orderTotal.signum() <= 0) {
            return 0;
        }
        int blocks = orderTotal.divide(loyaltyProperties.getSpendAmount(), 0, RoundingMode.FLOOR).intValueExact();
        return blocks * loyaltyProperties.getPointsEarned();
    }

    @Override
    public int pointsRequiredFor(BigDecimal orderTotal) {
        if (orderTotal == null || orderTotal.signum() <= 0) {
            return 0;
        }
        // Points are whole; a fractional total rounds up so the balance always covers it
        return orderTotal.setScale(0, RoundingMode.CEILING).intValueExact();
    }

    @Override
    @Transactional
    public void recordOrder(UUID customerId, UUID orderId, BigDecimal orderTotal, int earnedPoints) {
        if (linkRepository.linkIfAbsent(customerId, orderId) == 0) {
            log.info("Order already recorded for customer, skipping stats. customerId={}, orderId={}",
                    customerId, orderId);
            return;
        }

        int updated = customerRepository.recordOrder(customerId, orderTotal, earnedPoints);
        if (updated == 0) {
            throw new ResourceNotFoundException("Customer not found: " + customerId,
                    ErrorCode.CUSTOMER_NOT_FOUND.name());
        }
        log.info("Customer stats updated. customerId={}, orderId={}, amount={}, earnedPoints={}",
                customerId, orderId, orderTotal, earnedPoints);
    }

    @Override
    @Transactional
    public boolean debitLoyaltyPoints(UUID customerId, int points) {
        if (points <= 0) {
            return true;
        }
        boolean debited = customerRepository.debitLoyaltyPoints(customerId, points) == 1;
        if (debited) {
            log.info("Loyalty points debited. customerId={}, points={}", customerId, points);
        } else {
            log.warn("Loyalty debit rejected, balance too low. customerId={}, points={}", customerId, points);
        }
        return debited;
    }

    @Override
    @Transactional
    public void creditLoyaltyPoints(UUID customerId, int points) {
        if (points <= 0) {
            return;
        }
        if (customerRepository.creditLoyaltyPoints(customerId, points) == 0) {
            throw new ResourceNotFoundException("Customer not found: " + customerId,
                    ErrorCode.CUSTOMER_NOT_FOUND.name());
        }
        log.info("Loyalty points credited. customerId={}, points={}", customerId, points);
    }

    // first token is the first name, the rest is the last name
    static String[] splitName(String name) {
        String trimmed = trimToNull(name);
        if (trimmed == null) {
            return new String[]{DEFAULT_FIRST_NAME, null};
        }
        String[] parts = trimmed.split("\\s+", 2);
        return new String[]{parts[0], parts.length > 1 ? parts[1] : null};
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
