package com.tradedesk.exception;

import java.util.Map;

/** Lost a race on an order state transition. Retryable. */
public class ConcurrencyConflictException extends BaseException {

    public ConcurrencyConflictException(String orderId, String operation) {
        super(
                ErrorCode.CONCURRENCY_CONFLICT,
                String.format("Order %s is being modified concurrently, %s not applied", orderId, operation),
                Map.of("orderId", orderId, "operation", operation, "retryable", true));
    }
}
