package com.pos.orderservice.exception;

/**
 * Machine-readable codes returned in ErrorResponse.errorCode.
 */
public enum ErrorCode {
    // validation, rejected before any write
    EMPTY_ORDER,
    INVALID_PRICE,
    INVALID_SELECTION,
    EMPTY_REASON,

    // not found
    ITEM_NOT_FOUND,
    ORDER_NOT_FOUND,
    CUSTOMER_NOT_FOUND,

    // business rule
    ITEM_UNAVAILABLE,
    INSUFFICIENT_LOYALTY_POINTS,
    LOYALTY_PAYMENT_NOT_SETTLED,
    PAYMENT_STATUS_MANAGED,

    // state conflict, caller should re-fetch
    ALREADY_REQUESTED_OR_DECIDED,
    NOT_IN_REQUESTED_STATE,
    CONCURRENT_MODIFICATION
}
