package com.tradedesk.risk;

import com.tradedesk.exception.ValidationException;
import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the active {@link RiskLimits}. Readers take one reference per check; writers replace
 * the whole value atomically, so no check observes a partially updated configuration.
 */
public class RiskLimitsHolder {

    private static final Logger log = LoggerFactory.getLogger(RiskLimitsHolder.class);

    private final AtomicReference<RiskLimits> current;

    public RiskLimitsHolder(RiskLimits initial) {
        validate(initial);
        this.current = new AtomicReference<>(initial);
    }

    public RiskLimits get() {
        return current.get();
    }

    /** Validates and installs new limits, returning the previous ones. */
    public RiskLimits replace(RiskLimits limits) {
        validate(limits);
        RiskLimits previous = current.getAndSet(limits);
        log.info("Risk limits replaced: {} -> {}", previous, limits);
        return previous;
    }

    private static void validate(RiskLimits limits) {
        requireFraction("maxPositionFraction", limits.getMaxPositionFraction());
        requireFraction("maxConcentrationFraction", limits.getMaxConcentrationFraction());
        requireFraction("maxPairwiseCorrelation", limits.getMaxPairwiseCorrelation());
        requireFraction("maxDailyLossFraction", limits.getMaxDailyLossFraction());
        requireFraction("varConfidence", limits.getVarConfidence());
        if (limits.getVarConfidence().compareTo(BigDecimal.ONE) >= 0) {
            throw new ValidationException("varConfidence", "varConfidence must be below 1");
        }
        if (limits.getCorrelationWindow() < 2) {
            throw new ValidationException("correlationWindow", "correlationWindow must be at least 2");
        }
        BigDecimal volatility = limits.getMaxAnnualizedVolatility();
        if (volatility == null || volatility.signum() <= 0) {
            throw new ValidationException(
                    "maxAnnualizedVolatility", "maxAnnualizedVolatility must be positive, got " + volatility);
        }
        if (limits.getMaxVarFraction() != null) {
            requireFraction("maxVarFraction", limits.getMaxVarFraction());
        }
    }

    private static void requireFraction(String field, BigDecimal value) {
        if (value == null || value.signum() <= 0 || value.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidationException(field, field + " must be in (0, 1], got " + value);
        }
    }
}
