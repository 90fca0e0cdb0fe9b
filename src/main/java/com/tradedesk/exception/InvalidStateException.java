package com.tradedesk.exception;

import com.tradedesk.domain.enums.OrderStatus;
import java.util.Map;

/** An order transition was requested from a state that does not allow it. */
public class InvalidStateException extends BaseException {

    public InvalidStateException(String orderId, OrderStatus currentStatus, String operation) {
        super(
                ErrorCode.INVALID_STATE,
                String.format("Cannot %s order %s in status %s", operation, orderId, currentStatus),
                Map.of("orderId", orderId, "status", currentStatus.name(), "operation", operation));
    }
}
