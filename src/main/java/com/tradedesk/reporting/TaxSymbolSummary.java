package com.tradedesk.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Lot totals of one symbol within a {@link TaxReport}. */
@Data
@Builder
public class TaxSymbolSummary {

    private String symbol;
    private int lotCount;
    private int totalQuantity;
    private int soldQuantity;
    private int openQuantity;
    private BigDecimal costBasis;
    private BigDecimal realizedGain;
    private BigDecimal taxLiability;
}
