package com.pos.orderservice.config;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "pos.orders")
public class OrderProperties {

    // Calendar day used in the order number, i.e. the restaurant's local day
    @NotNull
    private ZoneId zoneId = ZoneId.of("UTC");
}
