package com.pos.orderservice.service;

import com.pos.orderservice.model.Customer;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CustomerResolution {
    private final Customer customer;
    private final boolean newCustomer;
}
