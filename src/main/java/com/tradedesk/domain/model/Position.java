package com.tradedesk.domain.model;

import com.tradedesk.domain.enums.PositionDirection;
import com.tradedesk.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate position for one (symbol, trading mode).
 *
 * <p>Quantity is signed: positive = LONG, negative = SHORT. The average price is the cost
 * basis per unit of the current exposure and resets to the fill price whenever the quantity
 * crosses zero. Unrealized P&L is {@code (marketPrice - averagePrice) * quantity}, which
 * yields the inverted sign for shorts automatically.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String symbol;
    private TradingMode mode;

    private int quantity;

    @Builder.Default
    private BigDecimal averagePrice = BigDecimal.ZERO;

    private BigDecimal marketPrice;

    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal totalPnl = BigDecimal.ZERO;

    /** Cumulative tax liability of all lots consumed for this position. */
    @Builder.Default
    private BigDecimal taxLiability = BigDecimal.ZERO;

    private LocalDateTime openedAt;
    private LocalDateTime closedAt;
    private LocalDateTime updatedAt;

    public static Position flat(PositionKey key) {
        return Position.builder().symbol(key.getSymbol()).mode(key.getMode()).build();
    }

    public PositionKey getKey() {
        return PositionKey.of(symbol, mode);
    }

    /** Derived from signed quantity. Null when flat. */
    public PositionDirection getDirection() {
        if (quantity == 0) {
            return null;
        }
        return quantity > 0 ? PositionDirection.LONG : PositionDirection.SHORT;
    }

    public boolean isFlat() {
        return quantity == 0;
    }

    /** Absolute exposure valued at the market price (or average price when never marked). */
    public BigDecimal getMarketValue() {
        BigDecimal price = marketPrice != null ? marketPrice : averagePrice;
        return price.multiply(BigDecimal.valueOf(Math.abs(quantity)));
    }

    public Position copy() {
        return toBuilder().build();
    }
}
