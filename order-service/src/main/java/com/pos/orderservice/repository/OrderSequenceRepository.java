package com.pos.orderservice.repository;

import com.pos.orderservice.model.DailyOrderSequence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;

@Repository
public interface OrderSequenceRepository extends JpaRepository<DailyOrderSequence, LocalDate> {

    /**
     * Creates the day's row or bumps it by one. The row stays locked until the
     * surrounding transaction ends, so concurrent creators are serialized and
     * every caller reads back its own value.
     */
    @Modifying(flushAutomatically = true)
    @Query(value = "INSERT INTO order_sequences (sequence_date, last_value) VALUES (:date, 1) " +
            "ON CONFLICT (sequence_date) DO UPDATE SET last_value = order_sequences.last_value + 1",
            nativeQuery = true)
    int increment(@Param("date") LocalDate date);

    @Query(value = "SELECT last_value FROM order_sequences WHERE sequence_date = :date", nativeQuery = true)
    int currentValue(@Param("date") LocalDate date);
}
