package com.tradedesk.domain.model;

import com.tradedesk.domain.enums.TradingMode;
import lombok.Value;

/** Identity of a position: one per (symbol, trading mode) pair. */
@Value(staticConstructor = "of")
public class PositionKey {

    String symbol;
    TradingMode mode;

    @Override
    public String toString() {
        return symbol + ":" + mode;
    }
}
