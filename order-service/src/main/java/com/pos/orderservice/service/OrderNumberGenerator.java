package com.pos.orderservice.service;

import com.pos.orderservice.config.OrderProperties;
import com.pos.orderservice.repository.OrderSequenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Issues receipt numbers of the form {@code ORD-yyyyMMdd-####}, sequential per calendar day.
 *
 * The counter lives in the database. Must run inside the order's transaction: the
 * sequence row stays locked until that transaction ends, so a rolled back order
 * also gives its number back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderNumberGenerator {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private final OrderSequenceRepository sequenceRepository;
    private final OrderProperties orderProperties;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextOrderNumber() {
        LocalDate today = LocalDate.now(clock.withZone(orderProperties.getZoneId()));

        sequenceRepository.increment(today);
        int sequence = sequenceRepository.currentValue(today);

        String orderNumber = format(today, sequence);
        log.debug("Issued order number. orderNumber={}", orderNumber);
        return orderNumber;
    }

    static String format(LocalDate day, int sequence) {
        return String.format("ORD-%s-%04d", day.format(DAY_FORMAT), sequence);
    }
}
