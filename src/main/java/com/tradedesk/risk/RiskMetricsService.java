package com.tradedesk.risk;

import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.enums.VarMethod;
import com.tradedesk.domain.model.PositionSnapshot;
import com.tradedesk.marketdata.MarketDataService;
import com.tradedesk.portfolio.PortfolioService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Applies {@link RiskMetricsCalculator} to market data and holdings.
 *
 * <p>Symbol returns come from the close history in MarketDataService. The portfolio return
 * series is the equal-weighted mean of the holdings' returns, aligned on the most recent
 * observations common to every holding.
 */
@Service
public class RiskMetricsService {

    private static final Logger log = LoggerFactory.getLogger(RiskMetricsService.class);

    public static final String PORTFOLIO = "PORTFOLIO";

    private static final int FRACTION_SCALE = 6;

    private final RiskMetricsCalculator calculator;
    private final MarketDataService marketDataService;
    private final PortfolioService portfolioService;
    private final RiskLimitsHolder riskLimitsHolder;
    private final int varLookback;

    public RiskMetricsService(
            RiskMetricsCalculator calculator,
            MarketDataService marketDataService,
            PortfolioService portfolioService,
            RiskLimitsHolder riskLimitsHolder,
            @Value("${tradedesk.risk.var-lookback:252}") int varLookback) {
        this.calculator = calculator;
        this.marketDataService = marketDataService;
        this.portfolioService = portfolioService;
        this.riskLimitsHolder = riskLimitsHolder;
        this.varLookback = varLookback;
    }

    /**
     * Computes VaR for a symbol position or, when {@code target} is {@value #PORTFOLIO}, for the
     * whole portfolio of the mode.
     *
     * @param confidence confidence level; null uses the configured risk-limit confidence
     */
    public VarResult computeVar(String target, VarMethod method, BigDecimal confidence, TradingMode mode) {
        BigDecimal level = confidence != null ? confidence : riskLimitsHolder.get().getVarConfidence();
        boolean portfolio = PORTFOLIO.equalsIgnoreCase(target.trim());
        String normalized = portfolio ? PORTFOLIO : MarketDataService.normalize(target);

        double[] returns = portfolio ? portfolioReturns(mode, varLookback) : symbolReturns(normalized, varLookback);
        double var = calculator.valueAtRisk(method, returns, level.doubleValue());
        double es = calculator.expectedShortfall(returns, level.doubleValue());

        BigDecimal exposure = portfolio ? portfolioService.portfolioValue(mode) : symbolExposure(normalized, mode);
        BigDecimal varFraction = fraction(var);
        BigDecimal esFraction = fraction(es);

        log.debug(
                "VaR computed: target={} mode={} method={} confidence={} n={} var={}",
                normalized,
                mode,
                method,
                level,
                returns.length,
                varFraction);

        return VarResult.builder()
                .target(normalized)
                .mode(mode)
                .method(method)
                .confidence(level)
                .observations(returns.length)
                .varFraction(varFraction)
                .expectedShortfallFraction(esFraction)
                .exposure(exposure)
                .varAmount(exposure.multiply(varFraction).setScale(2, RoundingMode.HALF_UP))
                .expectedShortfallAmount(exposure.multiply(esFraction).setScale(2, RoundingMode.HALF_UP))
                .build();
    }

    /** Historical portfolio VaR fraction at the configured confidence. Used by the risk gate. */
    public double portfolioHistoricalVar(TradingMode mode, double confidence) {
        return calculator.historicalVar(portfolioReturns(mode, varLookback), confidence);
    }

    /** The last {@code window} returns of a symbol, oldest first. */
    public double[] symbolReturns(String symbol, int window) {
        return calculator.returnsFromPrices(marketDataService.getCloseHistory(symbol, window + 1));
    }

    /** Equal-weighted mean of the holdings' returns over their common trailing window. */
    public double[] portfolioReturns(TradingMode mode, int window) {
        List<double[]> series = portfolioService.holdings(mode).stream()
                .map(p -> symbolReturns(p.getSymbol(), window))
                .toList();
        if (series.isEmpty()) {
            return new double[0];
        }
        int length = series.stream().mapToInt(s -> s.length).min().orElse(0);
        double[] combined = new double[length];
        for (double[] returns : series) {
            double[] aligned = Arrays.copyOfRange(returns, returns.length - length, returns.length);
            for (int i = 0; i < length; i++) {
                combined[i] += aligned[i] / series.size();
            }
        }
        return combined;
    }

    /**
     * Concentration, diversification and VaR of the mode's holdings, with plain-language
     * recommendations when limits are close.
     */
    public PortfolioRiskSummary portfolioRiskSummary(TradingMode mode) {
        RiskLimits limits = riskLimitsHolder.get();
        List<PositionSnapshot> holdings = portfolioService.holdings(mode);
        BigDecimal invested = holdings.stream()
                .map(PositionSnapshot::getMarketValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal portfolioValue = portfolioService.portfolioValue(mode);

        Map<String, BigDecimal> weights = new LinkedHashMap<>();
        if (invested.signum() > 0) {
            holdings.stream()
                    .sorted(Comparator.comparing(PositionSnapshot::getMarketValue).reversed())
                    .forEach(p -> weights.merge(
                            p.getSymbol(),
                            p.getMarketValue().divide(invested, FRACTION_SCALE, RoundingMode.HALF_UP),
                            BigDecimal::add));
        }

        BigDecimal hhi = weights.values().stream()
                .map(w -> w.multiply(w))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(FRACTION_SCALE, RoundingMode.HALF_UP);
        BigDecimal diversification = weights.isEmpty() ? BigDecimal.ZERO : BigDecimal.ONE.subtract(hhi);

        Map.Entry<String, BigDecimal> largest = weights.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElse(null);

        double confidence = limits.getVarConfidence().doubleValue();
        double[] returns = portfolioReturns(mode, varLookback);
        BigDecimal varFraction = fraction(calculator.historicalVar(returns, confidence));
        BigDecimal esFraction = fraction(calculator.expectedShortfall(returns, confidence));

        BigDecimal dailyRealized = portfolioService.todayRealizedPnl(mode);
        BigDecimal unrealized = portfolioService.unrealizedPnl(mode);

        List<String> recommendations = new ArrayList<>();
        if (largest != null && portfolioValue.signum() > 0) {
            BigDecimal largestShare = holdings.stream()
                    .filter(p -> p.getSymbol().equals(largest.getKey()))
                    .map(PositionSnapshot::getMarketValue)
                    .reduce(BigDecimal.ZERO, BigDecimal::add)
                    .divide(portfolioValue, FRACTION_SCALE, RoundingMode.HALF_UP);
            if (largestShare.compareTo(limits.getMaxConcentrationFraction()) > 0) {
                recommendations.add(String.format(
                        "Reduce %s: %s%% of portfolio exceeds the %s%% concentration limit",
                        largest.getKey(), percent(largestShare), percent(limits.getMaxConcentrationFraction())));
            }
        }
        if (weights.size() > 1 && diversification.compareTo(new BigDecimal("0.5")) < 0) {
            recommendations.add("Holdings are concentrated; spread exposure across more symbols");
        }
        if (limits.getMaxVarFraction() != null && varFraction.compareTo(limits.getMaxVarFraction()) > 0) {
            recommendations.add(String.format(
                    "Portfolio VaR %s%% is above the %s%% limit", percent(varFraction), percent(limits.getMaxVarFraction())));
        }
        BigDecimal dailyLoss = dailyRealized.add(unrealized).negate();
        BigDecimal lossBudget = limits.getMaxDailyLossFraction().multiply(portfolioValue);
        if (dailyLoss.signum() > 0 && dailyLoss.compareTo(lossBudget.multiply(new BigDecimal("0.8"))) >= 0) {
            recommendations.add("Daily loss is near its limit; new exposure may be rejected");
        }

        return PortfolioRiskSummary.builder()
                .mode(mode)
                .portfolioValue(portfolioValue)
                .cash(portfolioService.cash(mode))
                .investedValue(invested.setScale(2, RoundingMode.HALF_UP))
                .weights(weights)
                .largestPositionSymbol(largest != null ? largest.getKey() : null)
                .largestPositionWeight(largest != null ? largest.getValue() : BigDecimal.ZERO)
                .concentrationIndex(hhi)
                .diversificationScore(diversification)
                .varFraction(varFraction)
                .expectedShortfallFraction(esFraction)
                .varAmount(portfolioValue.multiply(varFraction).setScale(2, RoundingMode.HALF_UP))
                .dailyRealizedPnl(dailyRealized)
                .unrealizedPnl(unrealized)
                .recommendations(recommendations)
                .build();
    }

    private BigDecimal symbolExposure(String symbol, TradingMode mode) {
        return portfolioService.holdings(mode).stream()
                .filter(p -> p.getSymbol().equals(symbol))
                .map(PositionSnapshot::getMarketValue)
                .findFirst()
                .orElse(BigDecimal.ZERO);
    }

    private static BigDecimal fraction(double value) {
        return BigDecimal.valueOf(value).setScale(FRACTION_SCALE, RoundingMode.HALF_UP);
    }

    private static String percent(BigDecimal fraction) {
        return fraction.multiply(BigDecimal.valueOf(100)).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
