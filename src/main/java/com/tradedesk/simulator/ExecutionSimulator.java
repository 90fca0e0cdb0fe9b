package com.tradedesk.simulator;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.model.FillDecision;
import com.tradedesk.domain.model.Order;
import com.tradedesk.pnl.ChargeCalculator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Decides whether an order fills against the current market price, and at what price.
 *
 * <p>Fill rules:
 * <ul>
 *   <li>MARKET: always fills at the market price</li>
 *   <li>LIMIT BUY: fills when market &lt;= limit, at min(limit, market)</li>
 *   <li>LIMIT SELL: fills when market &gt;= limit, at max(limit, market)</li>
 *   <li>STOP_LOSS BUY: triggers when market &gt;= stop; SELL when market &lt;= stop; fills at market</li>
 *   <li>STOP_LIMIT: stop-loss trigger, then the limit rule clamps the price</li>
 * </ul>
 *
 * <p>Optional slippage ({@code tradedesk.simulator.slippage-bps}) moves MARKET and STOP_LOSS
 * fills against the trader. Optional liquidity cap ({@code tradedesk.simulator.max-fill-quantity})
 * limits one fill to that many units, producing partial fills. Both default to off.
 *
 * <p>Stateless: the same order and price always yield the same decision.
 */
@Service
public class ExecutionSimulator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionSimulator.class);

    private final ChargeCalculator chargeCalculator;
    private final int slippageBps;
    private final int maxFillQuantity;

    public ExecutionSimulator(
            ChargeCalculator chargeCalculator,
            @Value("${tradedesk.simulator.slippage-bps:0}") int slippageBps,
            @Value("${tradedesk.simulator.max-fill-quantity:0}") int maxFillQuantity) {
        this.chargeCalculator = chargeCalculator;
        this.slippageBps = slippageBps;
        this.maxFillQuantity = maxFillQuantity;
    }

    /**
     * Returns the fill for the order's remaining quantity, or empty if its price condition
     * is not met at {@code marketPrice}.
     */
    public Optional<FillDecision> decide(Order order, BigDecimal marketPrice) {
        BigDecimal fillPrice =
                switch (order.getType()) {
                    case MARKET -> applySlippage(marketPrice, order.getSide());
                    case LIMIT -> matchLimit(order.getSide(), order.getLimitPrice(), marketPrice);
                    case STOP_LOSS -> isStopTriggered(order, marketPrice)
                            ? applySlippage(marketPrice, order.getSide())
                            : null;
                    case STOP_LIMIT -> isStopTriggered(order, marketPrice)
                            ? matchLimit(order.getSide(), order.getLimitPrice(), marketPrice)
                            : null;
                };

        if (fillPrice == null) {
            log.debug(
                    "No fill: order={} type={} side={} market={}",
                    order.getId(),
                    order.getType(),
                    order.getSide(),
                    marketPrice);
            return Optional.empty();
        }

        int quantity = fillQuantity(order);
        return Optional.of(new FillDecision(fillPrice, quantity, chargeCalculator.calculate(fillPrice, quantity)));
    }

    /**
     * BUY fills at or below the limit, SELL at or above. The price is the better of
     * limit and market from the trader's side.
     */
    private BigDecimal matchLimit(OrderSide side, BigDecimal limitPrice, BigDecimal marketPrice) {
        if (side == OrderSide.BUY) {
            return marketPrice.compareTo(limitPrice) <= 0 ? marketPrice.min(limitPrice) : null;
        }
        return marketPrice.compareTo(limitPrice) >= 0 ? marketPrice.max(limitPrice) : null;
    }

    /** BUY stops trigger on a breakout (market at or above stop), SELL stops on a drop. */
    private boolean isStopTriggered(Order order, BigDecimal marketPrice) {
        int cmp = marketPrice.compareTo(order.getStopPrice());
        return order.getSide() == OrderSide.BUY ? cmp >= 0 : cmp <= 0;
    }

    private int fillQuantity(Order order) {
        int remaining = order.getRemainingQuantity();
        return maxFillQuantity > 0 ? Math.min(remaining, maxFillQuantity) : remaining;
    }

    BigDecimal applySlippage(BigDecimal price, OrderSide side) {
        if (slippageBps <= 0) {
            return price;
        }
        BigDecimal slippage = price.multiply(BigDecimal.valueOf(slippageBps))
                .divide(BigDecimal.valueOf(10000), 6, RoundingMode.HALF_UP);
        return side == OrderSide.BUY
                ? price.add(slippage).setScale(2, RoundingMode.HALF_UP)
                : price.subtract(slippage).setScale(2, RoundingMode.HALF_UP);
    }
}
