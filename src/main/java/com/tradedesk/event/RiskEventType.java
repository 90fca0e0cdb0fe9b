package com.tradedesk.event;

public enum RiskEventType {
    ORDER_REJECTED,
    LIMITS_UPDATED
}
