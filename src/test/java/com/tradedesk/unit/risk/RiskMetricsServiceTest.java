package com.tradedesk.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.enums.VarMethod;
import com.tradedesk.domain.model.Trade;
import com.tradedesk.domain.vo.ChargeBreakdown;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.ledger.PositionBook;
import com.tradedesk.marketdata.MarketDataService;
import com.tradedesk.pnl.ChargeCalculator;
import com.tradedesk.portfolio.PortfolioService;
import com.tradedesk.risk.PortfolioRiskSummary;
import com.tradedesk.risk.RiskLimits;
import com.tradedesk.risk.RiskLimitsHolder;
import com.tradedesk.risk.RiskMetricsCalculator;
import com.tradedesk.risk.RiskMetricsService;
import com.tradedesk.risk.VarResult;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for RiskMetricsService over a real book holding AAPL 100 @ 100 and MSFT 100 @ 200
 * (capital 100,000, no charges).
 *
 * <p>AAPL closes give returns -5%, +2%, +1%, -1%; MSFT is flat.
 */
@ExtendWith(MockitoExtension.class)
class RiskMetricsServiceTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private PositionBook positionBook;
    private PortfolioService portfolioService;
    private MarketDataService marketDataService;
    private RiskMetricsService service;

    @BeforeEach
    void setUp() {
        positionBook = new PositionBook(
                new ChargeCalculator(new BigDecimal("0.0015"), new BigDecimal("0.001")), eventPublisherHelper);
        portfolioService = new PortfolioService(positionBook, new BigDecimal("100000"));
        marketDataService = new MarketDataService(eventPublisherHelper, 500);
        service = new RiskMetricsService(
                new RiskMetricsCalculator(),
                marketDataService,
                portfolioService,
                new RiskLimitsHolder(RiskLimits.defaults()),
                252);

        fill("AAPL", 100, "100");
        fill("MSFT", 100, "200");
        marketDataService.loadHistory(
                "AAPL", List.of(price("100"), price("95"), price("96.9"), price("97.869"), price("96.89031")));
        marketDataService.loadHistory(
                "MSFT", List.of(price("200"), price("200"), price("200"), price("200"), price("200")));
    }

    @Test
    @DisplayName("Symbol VaR is scaled by the position's market value")
    void symbolVar() {
        VarResult result = service.computeVar("aapl", VarMethod.HISTORICAL, null, TradingMode.SIMULATED);

        assertThat(result.getTarget()).isEqualTo("AAPL");
        assertThat(result.getConfidence()).isEqualByComparingTo("0.95");
        assertThat(result.getObservations()).isEqualTo(4);
        assertThat(result.getVarFraction()).isEqualByComparingTo("0.05");
        assertThat(result.getExposure()).isEqualByComparingTo("10000");
        assertThat(result.getVarAmount()).isEqualByComparingTo("500.00");
        assertThat(result.getExpectedShortfallAmount()).isEqualByComparingTo("500.00");
    }

    @Test
    @DisplayName("Portfolio VaR uses the equal-weighted mean of holding returns")
    void portfolioVar() {
        VarResult result = service.computeVar(
                RiskMetricsService.PORTFOLIO, VarMethod.HISTORICAL, new BigDecimal("0.95"), TradingMode.SIMULATED);

        assertThat(result.getTarget()).isEqualTo(RiskMetricsService.PORTFOLIO);
        assertThat(result.getVarFraction()).isEqualByComparingTo("0.025");
        assertThat(result.getExposure()).isEqualByComparingTo("100000");
        assertThat(result.getVarAmount()).isEqualByComparingTo("2500.00");
    }

    @Test
    @DisplayName("A symbol without history or position has zero VaR")
    void unknownSymbol() {
        VarResult result = service.computeVar("TSLA", VarMethod.PARAMETRIC, null, TradingMode.SIMULATED);

        assertThat(result.getObservations()).isZero();
        assertThat(result.getVarFraction()).isEqualByComparingTo("0");
        assertThat(result.getVarAmount()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Summary reports weights, concentration and a diversification hint")
    void riskSummary() {
        PortfolioRiskSummary summary = service.portfolioRiskSummary(TradingMode.SIMULATED);

        assertThat(summary.getPortfolioValue()).isEqualByComparingTo("100000");
        assertThat(summary.getCash()).isEqualByComparingTo("70000");
        assertThat(summary.getInvestedValue()).isEqualByComparingTo("30000");
        assertThat(summary.getLargestPositionSymbol()).isEqualTo("MSFT");
        assertThat(summary.getLargestPositionWeight()).isEqualByComparingTo("0.666667");
        assertThat(summary.getConcentrationIndex()).isEqualByComparingTo("0.555556");
        assertThat(summary.getDiversificationScore()).isEqualByComparingTo("0.444444");
        assertThat(summary.getVarFraction()).isEqualByComparingTo("0.025");
        assertThat(summary.getVarAmount()).isEqualByComparingTo("2500.00");
        // MSFT is exactly at the 20% concentration limit, so only the diversification hint fires
        assertThat(summary.getRecommendations())
                .containsExactly("Holdings are concentrated; spread exposure across more symbols");
    }

    @Test
    @DisplayName("An empty mode has a zero summary")
    void emptySummary() {
        PortfolioRiskSummary summary = service.portfolioRiskSummary(TradingMode.LIVE);

        assertThat(summary.getWeights()).isEmpty();
        assertThat(summary.getLargestPositionSymbol()).isNull();
        assertThat(summary.getDiversificationScore()).isEqualByComparingTo("0");
        assertThat(summary.getVarFraction()).isEqualByComparingTo("0");
        assertThat(summary.getRecommendations()).isEmpty();
    }

    private void fill(String symbol, int quantity, String fillPrice) {
        Trade trade = Trade.builder()
                .id("trd-" + symbol)
                .orderId("ord-" + symbol)
                .symbol(symbol)
                .mode(TradingMode.SIMULATED)
                .side(OrderSide.BUY)
                .quantity(quantity)
                .fillPrice(new BigDecimal(fillPrice))
                .charges(ChargeBreakdown.zero())
                .realizedPnl(BigDecimal.ZERO)
                .executedAt(LocalDateTime.now())
                .build();
        positionBook.apply(trade, portfolioService::applyFill);
    }

    private static BigDecimal price(String value) {
        return new BigDecimal(value);
    }
}
