package com.tradedesk.config;

import com.tradedesk.risk.RiskLimits;
import com.tradedesk.risk.RiskLimitsHolder;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the startup {@link RiskLimits} from application properties and wraps them in the
 * {@link RiskLimitsHolder} that the risk gate reads.
 *
 * <p>Properties prefix: {@code tradedesk.risk.*}. The VaR limit defaults to null, which
 * disables the portfolio VaR check.
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimitsHolder riskLimitsHolder(
            @Value("${tradedesk.risk.max-position-fraction:0.10}") BigDecimal maxPositionFraction,
            @Value("${tradedesk.risk.max-concentration-fraction:0.20}") BigDecimal maxConcentrationFraction,
            @Value("${tradedesk.risk.max-pairwise-correlation:0.70}") BigDecimal maxPairwiseCorrelation,
            @Value("${tradedesk.risk.max-daily-loss-fraction:0.02}") BigDecimal maxDailyLossFraction,
            @Value("${tradedesk.risk.var-confidence:0.95}") BigDecimal varConfidence,
            @Value("${tradedesk.risk.correlation-window:30}") int correlationWindow,
            @Value("${tradedesk.risk.max-annualized-volatility:0.50}") BigDecimal maxAnnualizedVolatility,
            @Value("${tradedesk.risk.max-var-fraction:#{null}}") BigDecimal maxVarFraction) {
        return new RiskLimitsHolder(RiskLimits.builder()
                .maxPositionFraction(maxPositionFraction)
                .maxConcentrationFraction(maxConcentrationFraction)
                .maxPairwiseCorrelation(maxPairwiseCorrelation)
                .maxDailyLossFraction(maxDailyLossFraction)
                .varConfidence(varConfidence)
                .correlationWindow(correlationWindow)
                .maxAnnualizedVolatility(maxAnnualizedVolatility)
                .maxVarFraction(maxVarFraction)
                .build());
    }
}
