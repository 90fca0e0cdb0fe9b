package com.tradedesk.domain.enums;

/**
 * Order kinds supported by the execution simulator.
 * LIMIT and STOP_LIMIT require a limit price; STOP_LOSS and STOP_LIMIT require a stop price.
 */
public enum OrderType {
    MARKET,
    LIMIT,
    STOP_LOSS,
    STOP_LIMIT;

    public boolean requiresLimitPrice() {
        return this == LIMIT || this == STOP_LIMIT;
    }

    public boolean requiresStopPrice() {
        return this == STOP_LOSS || this == STOP_LIMIT;
    }
}
