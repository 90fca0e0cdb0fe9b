package com.tradedesk.reporting;

import com.tradedesk.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Lot-based tax summary for one trading mode.
 *
 * <p>Lot totals cover the lots acquired in {@code year} (all lots when year is null). The
 * trading figures cover the trades executed in that calendar year.
 *
 * <ul>
 *   <li>realizedGain: FIFO gain of the consumed part of those lots</li>
 *   <li>taxLiability: transaction tax on the proceeds of those consumptions</li>
 *   <li>turnover: sum of fill notional of the year's trades</li>
 * </ul>
 */
@Data
@Builder
public class TaxReport {

    private TradingMode mode;
    private Integer year;

    private int lotCount;
    private int totalQuantity;
    private int soldQuantity;
    private BigDecimal costBasis;
    private BigDecimal realizedGain;
    private BigDecimal taxLiability;

    private int tradeCount;
    private int buyCount;
    private int sellCount;
    private BigDecimal turnover;
    private BigDecimal totalCharges;
    private BigDecimal tradeRealizedPnl;

    private List<TaxSymbolSummary> symbols;
    private List<String> recommendations;
}
