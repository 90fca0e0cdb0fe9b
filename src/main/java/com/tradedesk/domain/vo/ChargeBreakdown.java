package com.tradedesk.domain.vo;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable breakdown of the fees charged on a single fill.
 *
 * <ul>
 *   <li>commission: fill value times the configured commission rate</li>
 *   <li>tax: fill value times the configured transaction tax rate</li>
 * </ul>
 */
@Value
@Builder
public class ChargeBreakdown {

    BigDecimal commission;
    BigDecimal tax;

    public BigDecimal getTotal() {
        return commission.add(tax);
    }

    public static ChargeBreakdown zero() {
        return ChargeBreakdown.builder()
                .commission(BigDecimal.ZERO)
                .tax(BigDecimal.ZERO)
                .build();
    }
}
