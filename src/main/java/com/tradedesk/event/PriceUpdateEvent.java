package com.tradedesk.event;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/** Published by MarketDataService whenever a new market price is recorded for a symbol. */
public class PriceUpdateEvent extends ApplicationEvent {

    private final String symbol;
    private final BigDecimal price;
    private final LocalDateTime observedAt;

    public PriceUpdateEvent(Object source, String symbol, BigDecimal price, LocalDateTime observedAt) {
        super(source);
        this.symbol = symbol;
        this.price = price;
        this.observedAt = observedAt;
    }

    public String getSymbol() {
        return symbol;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public LocalDateTime getObservedAt() {
        return observedAt;
    }
}
