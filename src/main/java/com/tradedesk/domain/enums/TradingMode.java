package com.tradedesk.domain.enums;

/**
 * Trading mode. Positions, cash and daily P&L are tracked separately per mode.
 * SIMULATED orders are executed immediately on placement; LIVE orders wait for an explicit
 * execution attempt unless auto-trading is enabled.
 */
public enum TradingMode {
    SIMULATED,
    LIVE
}
