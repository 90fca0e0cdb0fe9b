package com.tradedesk.pnl;

import com.tradedesk.domain.vo.ChargeBreakdown;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Fee model for simulated fills.
 *
 * <ul>
 *   <li><b>Commission:</b> fill price x quantity x commission rate (default 0.15%)</li>
 *   <li><b>Transaction tax:</b> fill price x quantity x tax rate (default 0.1%)</li>
 * </ul>
 *
 * <p>Both rates come from {@code tradedesk.charges.*}. The same tax rate is used by the lot
 * ledger to accrue tax liability on consumed lots.
 */
@Service
public class ChargeCalculator {

    private final BigDecimal commissionRate;
    private final BigDecimal taxRate;

    public ChargeCalculator(
            @Value("${tradedesk.charges.commission-rate:0.0015}") BigDecimal commissionRate,
            @Value("${tradedesk.charges.tax-rate:0.001}") BigDecimal taxRate) {
        this.commissionRate = commissionRate;
        this.taxRate = taxRate;
    }

    /**
     * Calculates the fees of one fill.
     *
     * @param fillPrice execution price per unit
     * @param quantity  filled quantity (always positive)
     * @return commission and tax, each rounded to 2 decimals
     */
    public ChargeBreakdown calculate(BigDecimal fillPrice, int quantity) {
        BigDecimal turnover = fillPrice.multiply(BigDecimal.valueOf(quantity));
        return ChargeBreakdown.builder()
                .commission(turnover.multiply(commissionRate).setScale(2, RoundingMode.HALF_UP))
                .tax(turnover.multiply(taxRate).setScale(2, RoundingMode.HALF_UP))
                .build();
    }

    /** Cash outlay of a buy: turnover plus all fees. */
    public BigDecimal totalCost(BigDecimal fillPrice, int quantity) {
        BigDecimal turnover = fillPrice.multiply(BigDecimal.valueOf(quantity));
        return turnover.add(calculate(fillPrice, quantity).getTotal()).setScale(2, RoundingMode.HALF_UP);
    }

    /** Cash received from a sell: turnover less all fees. */
    public BigDecimal netProceeds(BigDecimal fillPrice, int quantity) {
        BigDecimal turnover = fillPrice.multiply(BigDecimal.valueOf(quantity));
        return turnover.subtract(calculate(fillPrice, quantity).getTotal()).setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal getCommissionRate() {
        return commissionRate;
    }

    public BigDecimal getTaxRate() {
        return taxRate;
    }
}
