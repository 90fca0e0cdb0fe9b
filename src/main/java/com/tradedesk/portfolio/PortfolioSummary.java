package com.tradedesk.portfolio;

import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.PositionSnapshot;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Cash, exposure and P&L of one trading mode. */
@Value
@Builder
public class PortfolioSummary {

    TradingMode mode;
    BigDecimal initialCapital;
    BigDecimal cash;

    /** Gross market value of open positions (long and short exposure both count positive). */
    BigDecimal investedValue;

    /** Cash plus signed market value of open positions. */
    BigDecimal portfolioValue;

    BigDecimal realizedPnl;
    BigDecimal unrealizedPnl;
    BigDecimal totalPnl;
    BigDecimal dailyRealizedPnl;
    BigDecimal totalCharges;
    int openPositions;
    List<PositionSnapshot> positions;
}
