package com.tradedesk.domain.enums;

/** Value-at-Risk estimation method. */
public enum VarMethod {
    HISTORICAL,
    PARAMETRIC,
    MONTE_CARLO
}
