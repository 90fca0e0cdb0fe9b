package com.tradedesk.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Pre-trade risk limits. Fractions are of portfolio value (0.10 = 10%).
 *
 * <p>Immutable: a running check always sees one complete set of limits. Changes go through
 * {@link RiskLimitsHolder#replace(RiskLimits)}, which swaps the whole value between checks.
 * A null {@code maxVarFraction} disables the portfolio VaR check.
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {

    @Builder.Default
    BigDecimal maxPositionFraction = new BigDecimal("0.10");

    @Builder.Default
    BigDecimal maxConcentrationFraction = new BigDecimal("0.20");

    @Builder.Default
    BigDecimal maxPairwiseCorrelation = new BigDecimal("0.70");

    @Builder.Default
    BigDecimal maxDailyLossFraction = new BigDecimal("0.02");

    @Builder.Default
    BigDecimal varConfidence = new BigDecimal("0.95");

    /** Trailing number of daily returns used for correlation. */
    @Builder.Default
    int correlationWindow = 30;

    /** Annualized standard deviation of daily returns over the correlation window. */
    @Builder.Default
    BigDecimal maxAnnualizedVolatility = new BigDecimal("0.50");

    BigDecimal maxVarFraction;

    public static RiskLimits defaults() {
        return RiskLimits.builder().build();
    }
}
