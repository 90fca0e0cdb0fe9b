package com.tradedesk.domain.model;

import com.tradedesk.domain.enums.PositionDirection;
import com.tradedesk.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Read-only view of a position together with its open lots. */
@Value
@Builder
public class PositionSnapshot {

    String symbol;
    TradingMode mode;
    int quantity;
    PositionDirection direction;
    BigDecimal averagePrice;
    BigDecimal marketPrice;
    BigDecimal marketValue;
    BigDecimal realizedPnl;
    BigDecimal unrealizedPnl;
    BigDecimal totalPnl;
    BigDecimal taxLiability;
    List<Lot> openLots;

    public static PositionSnapshot of(Position position, List<Lot> openLots) {
        return PositionSnapshot.builder()
                .symbol(position.getSymbol())
                .mode(position.getMode())
                .quantity(position.getQuantity())
                .direction(position.getDirection())
                .averagePrice(position.getAveragePrice())
                .marketPrice(position.getMarketPrice())
                .marketValue(position.getMarketValue())
                .realizedPnl(position.getRealizedPnl())
                .unrealizedPnl(position.getUnrealizedPnl())
                .totalPnl(position.getTotalPnl())
                .taxLiability(position.getTaxLiability())
                .openLots(openLots.stream().map(Lot::copy).toList())
                .build();
    }

    public PositionKey getKey() {
        return PositionKey.of(symbol, mode);
    }
}
