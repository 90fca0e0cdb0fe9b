package com.tradedesk.domain.enums;

/**
 * Lifecycle status of an order.
 *
 * <p>PENDING is the state on construction. FILLED, CANCELLED, REJECTED and EXPIRED are terminal.
 */
public enum OrderStatus {
    PENDING,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED || this == EXPIRED;
    }

    /** Cancel (and expiry) is only allowed before the order reaches a terminal state. */
    public boolean isCancellable() {
        return this == PENDING || this == SUBMITTED || this == PARTIALLY_FILLED;
    }

    /** States from which the execution simulator may be consulted. */
    public boolean isFillable() {
        return this == SUBMITTED || this == PARTIALLY_FILLED;
    }
}
