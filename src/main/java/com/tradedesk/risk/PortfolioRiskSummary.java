package com.tradedesk.risk;

import com.tradedesk.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Portfolio-level risk figures: concentration, diversification, VaR and daily P&L. */
@Value
@Builder
public class PortfolioRiskSummary {

    TradingMode mode;
    BigDecimal portfolioValue;
    BigDecimal cash;
    BigDecimal investedValue;

    /** Exposure weight per symbol, as a fraction of invested value. */
    Map<String, BigDecimal> weights;

    String largestPositionSymbol;
    BigDecimal largestPositionWeight;

    /** Herfindahl-Hirschman index of the weights: 1.0 for a single holding. */
    BigDecimal concentrationIndex;

    /** 1 - concentrationIndex. */
    BigDecimal diversificationScore;

    BigDecimal varFraction;
    BigDecimal expectedShortfallFraction;
    BigDecimal varAmount;
    BigDecimal dailyRealizedPnl;
    BigDecimal unrealizedPnl;
    List<String> recommendations;
}
