package com.tradedesk.exception;

import java.util.Map;

/** No market price is known for the symbol. The order stays SUBMITTED and may be retried. */
public class PriceUnavailableException extends BaseException {

    public PriceUnavailableException(String symbol) {
        super(
                ErrorCode.PRICE_UNAVAILABLE,
                "No market price available for " + symbol,
                Map.of("symbol", symbol, "retryable", true));
    }
}
