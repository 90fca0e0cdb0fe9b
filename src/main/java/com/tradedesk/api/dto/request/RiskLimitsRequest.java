package com.tradedesk.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for updating risk limits. Only non-null fields are applied; the rest keep
 * their current values. {@code disableVarLimit} clears the VaR limit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskLimitsRequest {

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxPositionFraction;

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxConcentrationFraction;

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxPairwiseCorrelation;

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxDailyLossFraction;

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax(value = "1", inclusive = false)
    private BigDecimal varConfidence;

    @Min(2)
    private Integer correlationWindow;

    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxAnnualizedVolatility;

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxVarFraction;

    private boolean disableVarLimit;
}
