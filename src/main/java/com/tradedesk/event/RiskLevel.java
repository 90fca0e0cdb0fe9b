package com.tradedesk.event;

public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
