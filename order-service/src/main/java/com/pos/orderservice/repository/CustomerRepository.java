package com.pos.orderservice.repository;

import com.pos.orderservice.model.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Stats and loyalty balance are only changed through the bulk updates below,
 * so concurrent orders for the same customer never lose an increment.
 */
@Repository
public interface CustomerRepository extends JpaRepository<Customer, UUID> {

    Optional<Customer> findByPhoneAndIsActiveTrue(String phone);

    Optional<Customer> findByEmailAndIsActiveTrue(String email);

    @Modifying
    @Query("UPDATE Customer c SET c.totalOrders = c.totalOrders + 1, " +
            "c.totalSpent = c.totalSpent + :amount, " +
            "c.loyaltyPoints = c.loyaltyPoints + :earnedPoints " +
            "WHERE c.id = :id")
    int recordOrder(@Param("id") UUID id,
                    @Param("amount") BigDecimal amount,
                    @Param("earnedPoints") int earnedPoints);

    @Modifying
    @Query("UPDATE Customer c SET c.loyaltyPoints = c.loyaltyPoints + :points WHERE c.id = :id")
    int creditLoyaltyPoints(@Param("id") UUID id, @Param("points") int points);

    // 0 rows when the balance is too low, nothing is changed in that case
    @Modifying
    @Query("UPDATE Customer c SET c.loyaltyPoints = c.loyaltyPoints - :points " +
            "WHERE c.id = :id AND c.loyaltyPoints >= :points")
    int debitLoyaltyPoints(@Param("id") UUID id, @Param("points") int points);
}
