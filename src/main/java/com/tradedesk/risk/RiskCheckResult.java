package com.tradedesk.risk;

import lombok.Getter;

/**
 * Outcome of {@link RiskGate#check}: allowed, or denied by the first failing check.
 */
@Getter
public class RiskCheckResult {

    private final boolean allowed;
    private final RiskViolation violation;

    private RiskCheckResult(boolean allowed, RiskViolation violation) {
        this.allowed = allowed;
        this.violation = violation;
    }

    public static RiskCheckResult allowed() {
        return new RiskCheckResult(true, null);
    }

    public static RiskCheckResult denied(RiskViolation violation) {
        return new RiskCheckResult(false, violation);
    }

    public boolean isDenied() {
        return !allowed;
    }
}
