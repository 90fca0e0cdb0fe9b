package com.tradedesk.domain.enums;

/** Pre-trade risk checks, in the order the gate evaluates them. */
public enum RiskCheckType {
    POSITION_SIZE,
    CONCENTRATION,
    CORRELATION,
    VOLATILITY,
    DAILY_LOSS,
    PORTFOLIO_VAR
}
