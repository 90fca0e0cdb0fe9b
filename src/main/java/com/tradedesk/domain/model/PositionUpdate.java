package com.tradedesk.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of applying a trade to a position: the resulting position, the lots that changed
 * (consumed or newly opened) and the P&L realized by the trade.
 */
@Value
@Builder
public class PositionUpdate {

    Trade trade;
    Position previous;
    Position position;
    List<Lot> changedLots;
    int closedQuantity;
    int openedQuantity;
    BigDecimal realizedPnl;
    BigDecimal taxLiability;

    public boolean isFlipped() {
        return closedQuantity > 0 && openedQuantity > 0;
    }
}
