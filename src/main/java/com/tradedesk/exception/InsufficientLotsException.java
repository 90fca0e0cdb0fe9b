package com.tradedesk.exception;

import java.util.Map;

/** A consumption requested more quantity than the open lots hold. Never clamped. */
public class InsufficientLotsException extends BaseException {

    public InsufficientLotsException(String symbol, int requested, int available) {
        super(
                ErrorCode.INSUFFICIENT_LOTS,
                String.format(
                        "Insufficient lots for %s: requested %d, available %d", symbol, requested, available),
                Map.of("symbol", symbol, "requested", requested, "available", available));
    }
}
