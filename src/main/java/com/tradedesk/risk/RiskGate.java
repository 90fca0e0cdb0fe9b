package com.tradedesk.risk;

import com.tradedesk.domain.enums.RiskCheckType;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.PositionSnapshot;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.event.RiskEventType;
import com.tradedesk.event.RiskLevel;
import com.tradedesk.ledger.PositionBook;
import com.tradedesk.portfolio.PortfolioService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pre-trade risk checks, evaluated in order and stopping at the first failure:
 * <ol>
 *   <li>POSITION_SIZE: |projected net quantity| x price &lt;= maxPositionFraction x portfolio value</li>
 *   <li>CONCENTRATION: (|quantity held in the symbol across all modes| + order quantity) x price
 *       &lt;= maxConcentrationFraction x portfolio value, regardless of direction</li>
 *   <li>CORRELATION: |correlation| of trailing returns with every other holding
 *       &lt;= maxPairwiseCorrelation; skipped for pairs without enough history</li>
 *   <li>VOLATILITY: annualized volatility of the symbol's trailing returns
 *       &lt;= maxAnnualizedVolatility; skipped without enough history</li>
 *   <li>DAILY_LOSS: today's realized plus current unrealized loss &lt;= maxDailyLossFraction x
 *       portfolio value</li>
 *   <li>PORTFOLIO_VAR: historical VaR &lt;= maxVarFraction (only when configured)</li>
 * </ol>
 * A value exactly at its limit passes. Orders that only reduce an existing position without
 * flipping it are always allowed. The order's size is its remaining quantity: a partially
 * filled order already has its filled part in the position.
 *
 * <p>Evaluation runs inside {@link PositionBook#withConsistentView}, so positions, cash and
 * daily P&L are read from one state with no trade half-applied.
 */
@Service
public class RiskGate {

    private static final Logger log = LoggerFactory.getLogger(RiskGate.class);

    private static final int FRACTION_SCALE = 6;

    private final PositionBook positionBook;
    private final PortfolioService portfolioService;
    private final RiskMetricsService riskMetricsService;
    private final RiskMetricsCalculator calculator;
    private final RiskLimitsHolder riskLimitsHolder;
    private final EventPublisherHelper eventPublisherHelper;

    public RiskGate(
            PositionBook positionBook,
            PortfolioService portfolioService,
            RiskMetricsService riskMetricsService,
            RiskMetricsCalculator calculator,
            RiskLimitsHolder riskLimitsHolder,
            EventPublisherHelper eventPublisherHelper) {
        this.positionBook = positionBook;
        this.portfolioService = portfolioService;
        this.riskMetricsService = riskMetricsService;
        this.calculator = calculator;
        this.riskLimitsHolder = riskLimitsHolder;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Evaluates the order at {@code referencePrice}.
     *
     * @return allowed, or denied with the first violated limit and its excess
     */
    public RiskCheckResult check(Order order, BigDecimal referencePrice) {
        RiskCheckResult result = preview(order, referencePrice);
        if (result.isDenied()) {
            RiskViolation violation = result.getViolation();
            log.warn(
                    "Risk check denied: order={} symbol={} side={} qty={} violation={}",
                    order.getId(),
                    order.getSymbol(),
                    order.getSide(),
                    order.getQuantity(),
                    violation);
            eventPublisherHelper.publishRiskEvent(
                    this, RiskEventType.ORDER_REJECTED, RiskLevel.WARNING, violation.getMessage(), violation.toDetails());
        } else {
            log.debug("Risk check passed: order={} symbol={}", order.getId(), order.getSymbol());
        }
        return result;
    }

    /**
     * Same checks as {@link #check} but with no event or log on a denial. Used for what-if
     * previews that never become orders.
     */
    public RiskCheckResult preview(Order order, BigDecimal referencePrice) {
        RiskLimits limits = riskLimitsHolder.get();
        return positionBook.withConsistentView(() -> evaluate(order, referencePrice, limits));
    }

    private RiskCheckResult evaluate(Order order, BigDecimal price, RiskLimits limits) {
        TradingMode mode = order.getMode();
        PositionSnapshot current = positionBook.getPosition(order.getSymbol(), mode);
        int currentQuantity = current.getQuantity();
        int orderQuantity = order.getRemainingQuantity();
        int signedOrder = order.getSide().sign() * orderQuantity;

        if (isReducing(currentQuantity, signedOrder)) {
            return RiskCheckResult.allowed();
        }

        BigDecimal portfolioValue = portfolioService.portfolioValue(mode);
        if (portfolioValue.signum() <= 0) {
            return RiskCheckResult.denied(RiskViolation.builder()
                    .code("PORTFOLIO_VALUE_NON_POSITIVE")
                    .checkType(RiskCheckType.POSITION_SIZE)
                    .limit(BigDecimal.ZERO)
                    .actual(portfolioValue)
                    .excess(portfolioValue.negate())
                    .message("Portfolio value " + portfolioValue + " leaves no room for new exposure")
                    .build());
        }

        int projected = currentQuantity + signedOrder;
        BigDecimal positionValue = price.multiply(BigDecimal.valueOf(Math.abs(projected)));
        RiskViolation violation = checkFraction(
                RiskCheckType.POSITION_SIZE,
                positionValue,
                portfolioValue,
                limits.getMaxPositionFraction(),
                "Position in " + order.getSymbol());
        if (violation != null) {
            return RiskCheckResult.denied(violation);
        }

        int heldAcrossModes = 0;
        for (TradingMode anyMode : TradingMode.values()) {
            heldAcrossModes += Math.abs(positionBook.getPosition(order.getSymbol(), anyMode).getQuantity());
        }
        BigDecimal grossValue = price.multiply(BigDecimal.valueOf((long) heldAcrossModes + orderQuantity));
        violation = checkFraction(
                RiskCheckType.CONCENTRATION,
                grossValue,
                portfolioValue,
                limits.getMaxConcentrationFraction(),
                "Gross exposure to " + order.getSymbol());
        if (violation != null) {
            return RiskCheckResult.denied(violation);
        }

        violation = checkCorrelation(order, limits);
        if (violation != null) {
            return RiskCheckResult.denied(violation);
        }

        violation = checkVolatility(order, limits);
        if (violation != null) {
            return RiskCheckResult.denied(violation);
        }

        BigDecimal dailyLoss = portfolioService.todayRealizedPnl(mode)
                .add(portfolioService.unrealizedPnl(mode))
                .negate()
                .max(BigDecimal.ZERO);
        violation = checkFraction(
                RiskCheckType.DAILY_LOSS,
                dailyLoss,
                portfolioValue,
                limits.getMaxDailyLossFraction(),
                "Today's loss");
        if (violation != null) {
            return RiskCheckResult.denied(violation);
        }

        if (limits.getMaxVarFraction() != null) {
            double var = riskMetricsService.portfolioHistoricalVar(mode, limits.getVarConfidence().doubleValue());
            BigDecimal actual = BigDecimal.valueOf(var).setScale(FRACTION_SCALE, RoundingMode.HALF_UP);
            if (actual.compareTo(limits.getMaxVarFraction()) > 0) {
                return RiskCheckResult.denied(RiskViolation.of(
                        RiskCheckType.PORTFOLIO_VAR,
                        limits.getMaxVarFraction(),
                        actual,
                        String.format(
                                "Portfolio VaR %s exceeds limit %s at %s confidence",
                                actual.toPlainString(),
                                limits.getMaxVarFraction().toPlainString(),
                                limits.getVarConfidence().toPlainString())));
            }
        }

        return RiskCheckResult.allowed();
    }

    /** Opposite direction and no larger than the open quantity: exposure only shrinks. */
    static boolean isReducing(int currentQuantity, int signedOrder) {
        return currentQuantity != 0
                && Integer.signum(currentQuantity) != Integer.signum(signedOrder)
                && Math.abs(signedOrder) <= Math.abs(currentQuantity);
    }

    /**
     * Compares {@code value} with {@code limit x portfolioValue} without dividing, so a value
     * exactly on the limit passes. The reported figures are fractions of portfolio value.
     */
    private RiskViolation checkFraction(
            RiskCheckType checkType, BigDecimal value, BigDecimal portfolioValue, BigDecimal limit, String subject) {
        if (value.compareTo(limit.multiply(portfolioValue)) <= 0) {
            return null;
        }
        BigDecimal actual = value.divide(portfolioValue, FRACTION_SCALE, RoundingMode.HALF_UP);
        return RiskViolation.of(
                checkType,
                limit,
                actual,
                String.format(
                        "%s at %s of portfolio exceeds %s limit %s",
                        subject, actual.toPlainString(), checkType, limit.toPlainString()));
    }

    private RiskViolation checkVolatility(Order order, RiskLimits limits) {
        double[] returns = riskMetricsService.symbolReturns(order.getSymbol(), limits.getCorrelationWindow());
        if (returns.length < 2) {
            return null;
        }
        BigDecimal actual = BigDecimal.valueOf(calculator.annualizedVolatility(returns))
                .setScale(FRACTION_SCALE, RoundingMode.HALF_UP);
        if (actual.compareTo(limits.getMaxAnnualizedVolatility()) <= 0) {
            return null;
        }
        return RiskViolation.of(
                RiskCheckType.VOLATILITY,
                limits.getMaxAnnualizedVolatility(),
                actual,
                String.format(
                        "Annualized volatility of %s is %s, limit %s",
                        order.getSymbol(),
                        actual.toPlainString(),
                        limits.getMaxAnnualizedVolatility().toPlainString()));
    }

    private RiskViolation checkCorrelation(Order order, RiskLimits limits) {
        int window = limits.getCorrelationWindow();
        double[] orderReturns = riskMetricsService.symbolReturns(order.getSymbol(), window);
        if (orderReturns.length < 2) {
            return null;
        }
        for (PositionSnapshot holding : portfolioService.holdings(order.getMode())) {
            if (holding.getSymbol().equals(order.getSymbol())) {
                continue;
            }
            OptionalDouble correlation =
                    calculator.correlation(orderReturns, riskMetricsService.symbolReturns(holding.getSymbol(), window));
            if (correlation.isEmpty()) {
                continue;
            }
            BigDecimal actual = BigDecimal.valueOf(correlation.getAsDouble()).setScale(FRACTION_SCALE, RoundingMode.HALF_UP);
            if (actual.compareTo(limits.getMaxPairwiseCorrelation()) > 0) {
                return RiskViolation.of(
                        RiskCheckType.CORRELATION,
                        limits.getMaxPairwiseCorrelation(),
                        actual,
                        String.format(
                                "Correlation of %s with holding %s is %s, limit %s",
                                order.getSymbol(),
                                holding.getSymbol(),
                                actual.toPlainString(),
                                limits.getMaxPairwiseCorrelation().toPlainString()));
            }
        }
        return null;
    }
}
