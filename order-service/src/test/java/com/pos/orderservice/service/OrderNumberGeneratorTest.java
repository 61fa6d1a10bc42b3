package com.pos.orderservice.service;

import com.pos.orderservice.config.OrderProperties;
import com.pos.orderservice.repository.OrderSequenceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderNumberGeneratorTest {

    @Mock
    private OrderSequenceRepository sequenceRepository;

    private OrderProperties orderProperties;

    @BeforeEach
    void setUp() {
        orderProperties = new OrderProperties();
    }

    @Test
    void nextOrderNumber_UsesDailySequence() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        LocalDate day = LocalDate.of(2026, 1, 15);
        when(sequenceRepository.currentValue(day)).thenReturn(7);

        String orderNumber = new OrderNumberGenerator(sequenceRepository, orderProperties, clock).nextOrderNumber();

        assertThat(orderNumber).isEqualTo("ORD-20260115-0007");
        verify(sequenceRepository).increment(day);
    }

    @Test
    void nextOrderNumber_DayFollowsConfiguredZone() {
        // 20:00 UTC is already the next day in Kolkata
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T20:00:00Z"), ZoneOffset.UTC);
        orderProperties.setZoneId(ZoneId.of("Asia/Kolkata"));
        LocalDate day = LocalDate.of(2026, 1, 16);
        when(sequenceRepository.currentValue(day)).thenReturn(1);

        String orderNumber = new OrderNumberGenerator(sequenceRepository, orderProperties, clock).nextOrderNumber();

        assertThat(orderNumber).isEqualTo("ORD-20260116-0001");
    }

    @Test
    void format_PadsToFourDigits() {
        LocalDate day = LocalDate.of(2026, 3, 1);

        assertThat(OrderNumberGenerator.format(day, 42)).isEqualTo("ORD-20260301-0042");
        assertThat(OrderNumberGenerator.format(day, 12345)).isEqualTo("ORD-20260301-12345");
    }
}
