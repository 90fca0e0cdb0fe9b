package com.tradedesk.risk;

import com.tradedesk.domain.enums.RiskCheckType;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * A single failed risk check: which limit, its configured value, the observed value
 * and the amount by which the limit was exceeded.
 */
@Getter
@Builder
public class RiskViolation {

    private final String code;
    private final RiskCheckType checkType;
    private final BigDecimal limit;
    private final BigDecimal actual;
    private final BigDecimal excess;
    private final String message;

    public static RiskViolation of(RiskCheckType checkType, BigDecimal limit, BigDecimal actual, String message) {
        return RiskViolation.builder()
                .code(checkType.name() + "_EXCEEDED")
                .checkType(checkType)
                .limit(limit)
                .actual(actual)
                .excess(actual.subtract(limit))
                .message(message)
                .build();
    }

    /** Machine-readable form used in error responses and risk events. */
    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("limitName", code);
        details.put("checkType", checkType.name());
        details.put("limit", limit);
        details.put("actual", actual);
        details.put("excess", excess);
        return details;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
