package com.pos.orderservice.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Earn ratio: {@code pointsEarned} points per full {@code spendAmount} spent.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "pos.loyalty")
public class LoyaltyProperties {

    @NotNull
    @Positive
    private BigDecimal spendAmount = BigDecimal.TEN;

    @Min(0)
    private int pointsEarned = 1;
}
