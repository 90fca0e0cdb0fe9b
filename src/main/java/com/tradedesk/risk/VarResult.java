package com.tradedesk.risk;

import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.enums.VarMethod;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * VaR of a symbol position or the whole portfolio. Fractions are per unit of exposure;
 * amounts are fraction times the current exposure value.
 */
@Value
@Builder
public class VarResult {

    String target;
    TradingMode mode;
    VarMethod method;
    BigDecimal confidence;
    int observations;
    BigDecimal varFraction;
    BigDecimal expectedShortfallFraction;
    BigDecimal exposure;
    BigDecimal varAmount;
    BigDecimal expectedShortfallAmount;
}
