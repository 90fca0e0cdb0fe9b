package com.tradedesk.exception;

import com.tradedesk.risk.RiskViolation;
import lombok.Getter;

/** A pre-trade risk check denied the order. Details name the limit and the excess. */
@Getter
public class RiskLimitExceededException extends BaseException {

    private final RiskViolation violation;

    public RiskLimitExceededException(RiskViolation violation) {
        super(ErrorCode.RISK_LIMIT_EXCEEDED, violation.getMessage(), violation.toDetails());
        this.violation = violation;
    }
}
