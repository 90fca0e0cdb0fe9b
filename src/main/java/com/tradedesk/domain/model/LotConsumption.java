package com.tradedesk.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Outcome of consuming lots FIFO: totals plus the per-lot slices that were taken. */
@Value
@Builder
public class LotConsumption {

    int quantity;
    BigDecimal realizedPnl;
    BigDecimal taxLiability;
    List<Slice> slices;

    /** Copies of the consumed lots as they stand after consumption. */
    List<Lot> lots;

    public static LotConsumption none() {
        return LotConsumption.builder()
                .quantity(0)
                .realizedPnl(BigDecimal.ZERO)
                .taxLiability(BigDecimal.ZERO)
                .slices(List.of())
                .lots(List.of())
                .build();
    }

    /** The part of one lot consumed by a single fill. */
    @Value
    public static class Slice {
        String lotId;
        int quantity;
        BigDecimal unitCost;
        BigDecimal realizedPnl;
    }
}
