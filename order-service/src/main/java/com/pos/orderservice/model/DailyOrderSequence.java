package com.pos.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Per-day counter behind order numbers. One row per calendar day,
 * incremented in the database (never in memory) by OrderSequenceRepository.
 */
@Entity
@Table(name = "order_sequences")
@Getter
@Setter
public class DailyOrderSequence {

    @Id
    @Column(name = "sequence_date")
    private LocalDate sequenceDate;

    @Column(name = "last_value", nullable = false)
    private int lastValue;
}
