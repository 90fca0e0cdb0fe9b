package com.tradedesk.event;

/** Kinds of order state change published as {@link OrderEvent}. */
public enum OrderEventType {
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED
}
