package com.tradedesk.domain.model;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.vo.ChargeBreakdown;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable execution record. Exactly one Trade is created per fill; a partially filled
 * order accumulates one Trade for each fill.
 */
@Value
@Builder(toBuilder = true)
public class Trade {

    String id;
    String orderId;
    String symbol;
    TradingMode mode;
    OrderSide side;
    int quantity;
    BigDecimal fillPrice;
    ChargeBreakdown charges;

    /** P&L realized by the lots this fill consumed. Zero for fills that only open exposure. */
    BigDecimal realizedPnl;

    LocalDateTime executedAt;

    public BigDecimal getNotional() {
        return fillPrice.multiply(BigDecimal.valueOf(quantity));
    }

    public PositionKey getPositionKey() {
        return PositionKey.of(symbol, mode);
    }
}
