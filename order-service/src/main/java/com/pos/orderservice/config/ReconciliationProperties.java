package com.pos.orderservice.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "pos.reconciliation")
public class ReconciliationProperties {

    /**
     * Orders younger than this are left alone; their own post-commit step
     * may still be running.
     */
    @NotNull
    private Duration gracePeriod = Duration.ofMinutes(1);

    @Min(1)
    @Max(1000)
    private int batchSize = 100;
}
