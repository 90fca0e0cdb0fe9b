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
 * A FIFO cost-basis unit: a dated block of quantity acquired at a fixed unit cost.
 *
 * <p>{@code remainingQuantity + soldQuantity == originalQuantity} and
 * {@code remainingQuantity >= 0} hold at all times. The sequence number orders lots that
 * share an acquisition time by insertion.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Lot {

    private String id;
    private String symbol;
    private TradingMode mode;
    private PositionDirection direction;

    private int originalQuantity;
    private int remainingQuantity;
    private BigDecimal unitCost;
    private LocalDateTime acquiredAt;
    private long sequence;

    private int soldQuantity;

    @Builder.Default
    private BigDecimal realizedGain = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal taxLiability = BigDecimal.ZERO;

    public boolean isOpen() {
        return remainingQuantity > 0;
    }

    public BigDecimal getCostBasis() {
        return unitCost.multiply(BigDecimal.valueOf(originalQuantity));
    }

    public Lot copy() {
        return toBuilder().build();
    }
}
