package com.tradedesk.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.Lot;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.PositionSnapshot;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.ledger.PositionBook;
import com.tradedesk.marketdata.MarketDataService;
import com.tradedesk.oms.OrderExpiryMonitor;
import com.tradedesk.oms.OrderLifecycleManager;
import com.tradedesk.oms.OrderRequest;
import com.tradedesk.oms.PendingOrderScanner;
import com.tradedesk.persistence.LedgerRecoveryService;
import com.tradedesk.pnl.ChargeCalculator;
import com.tradedesk.portfolio.PortfolioService;
import com.tradedesk.reporting.TaxReport;
import com.tradedesk.reporting.TaxReportService;
import com.tradedesk.risk.RiskGate;
import com.tradedesk.risk.RiskLimits;
import com.tradedesk.risk.RiskLimitsHolder;
import com.tradedesk.risk.RiskMetricsCalculator;
import com.tradedesk.risk.RiskMetricsService;
import com.tradedesk.simulator.ExecutionSimulator;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

/**
 * Cross-service integration test: places orders through the lifecycle manager with the real
 * simulator, risk gate, position book and portfolio, then reads the persisted ledger back
 * through the tax report and a fresh set of services restored from the same store.
 *
 * <p>Charges: 0.15% fees plus 0.1% tax on every fill. Initial capital 10,000,000.
 */
class OrderFlowIntegrationTest {

    private static final String SYMBOL = "INFY";
    private static final BigDecimal INITIAL_CAPITAL = new BigDecimal("10000000");

    private InMemoryLedgerStore ledgerStore;
    private Services services;

    @BeforeEach
    void setUp() {
        ledgerStore = new InMemoryLedgerStore();
        services = new Services(ledgerStore);
    }

    @Test
    @DisplayName("Buys then a resting limit sell: FIFO P&L, cash, tax report and recovery agree")
    void buySellReportRecover() {
        services.marketData.updatePrice(SYMBOL, new BigDecimal("1000"));
        Order firstBuy = services.oms.place(request(OrderSide.BUY, OrderType.MARKET, 100, null));

        services.marketData.updatePrice(SYMBOL, new BigDecimal("1100"));
        Order secondBuy = services.oms.place(request(OrderSide.BUY, OrderType.MARKET, 50, null));

        assertThat(firstBuy.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(secondBuy.getStatus()).isEqualTo(OrderStatus.FILLED);
        PositionSnapshot afterBuys = services.positionBook.getPosition(SYMBOL, TradingMode.SIMULATED);
        assertThat(afterBuys.getQuantity()).isEqualTo(150);
        assertThat(afterBuys.getAveragePrice()).isEqualByComparingTo("1033.3333");
        // 100250.00 + 55137.50 spent
        assertThat(services.portfolio.cash(TradingMode.SIMULATED)).isEqualByComparingTo("9844612.50");

        services.marketData.updatePrice(SYMBOL, new BigDecimal("1150"));
        Order sell = services.oms.place(request(OrderSide.SELL, OrderType.LIMIT, 120, new BigDecimal("1200")));
        assertThat(sell.getStatus()).isEqualTo(OrderStatus.SUBMITTED);
        assertThat(services.scanner.scan()).isZero();

        services.marketData.updatePrice(SYMBOL, new BigDecimal("1200"));
        assertThat(services.scanner.scan()).isEqualTo(1);

        Order filledSell = services.oms.getOrder(sell.getId());
        assertThat(filledSell.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(filledSell.getAverageFillPrice()).isEqualByComparingTo("1200");

        // FIFO: 100 x (1200 - 1000) + 20 x (1200 - 1100)
        PositionSnapshot afterSell = services.positionBook.getPosition(SYMBOL, TradingMode.SIMULATED);
        assertThat(afterSell.getQuantity()).isEqualTo(30);
        assertThat(afterSell.getRealizedPnl()).isEqualByComparingTo("22000");
        assertThat(afterSell.getOpenLots()).singleElement().satisfies(lot -> {
            assertThat(lot.getRemainingQuantity()).isEqualTo(30);
            assertThat(lot.getUnitCost()).isEqualByComparingTo("1100");
        });
        // 144000 proceeds less 216.00 fees and 144.00 tax
        BigDecimal cashAfterSell = services.portfolio.cash(TradingMode.SIMULATED);
        assertThat(cashAfterSell).isEqualByComparingTo("9988252.50");

        TaxReport report = new TaxReportService(ledgerStore, new BigDecimal("1000000"))
                .summary(TradingMode.SIMULATED, null);
        assertThat(report.getLotCount()).isEqualTo(2);
        assertThat(report.getSoldQuantity()).isEqualTo(120);
        assertThat(report.getRealizedGain()).isEqualByComparingTo("22000.00");
        assertThat(report.getTaxLiability()).isEqualByComparingTo("144.00");
        assertThat(report.getTradeCount()).isEqualTo(3);
        assertThat(report.getSellCount()).isEqualTo(1);

        Services restarted = new Services(ledgerStore);
        restarted.recovery.recover();

        PositionSnapshot restored = restarted.positionBook.getPosition(SYMBOL, TradingMode.SIMULATED);
        assertThat(restored.getQuantity()).isEqualTo(30);
        assertThat(restored.getAveragePrice()).isEqualByComparingTo(afterSell.getAveragePrice());
        assertThat(restored.getRealizedPnl()).isEqualByComparingTo("22000");
        assertThat(restored.getOpenLots())
                .extracting(Lot::getId)
                .containsExactlyElementsOf(afterSell.getOpenLots().stream().map(Lot::getId).toList());
        assertThat(restarted.portfolio.cash(TradingMode.SIMULATED)).isEqualByComparingTo(cashAfterSell);
    }

    @Test
    @DisplayName("A resting order survives a restart and fills on the restored book")
    void restingOrderRecovered() {
        services.marketData.updatePrice(SYMBOL, new BigDecimal("1000"));
        services.oms.place(request(OrderSide.BUY, OrderType.MARKET, 10, null));
        Order resting = services.oms.place(request(OrderSide.BUY, OrderType.LIMIT, 5, new BigDecimal("950")));
        assertThat(resting.getStatus()).isEqualTo(OrderStatus.SUBMITTED);

        Services restarted = new Services(ledgerStore);
        restarted.recovery.recover();
        assertThat(restarted.oms.getActiveOrders()).extracting(Order::getId).containsExactly(resting.getId());

        restarted.marketData.updatePrice(SYMBOL, new BigDecimal("940"));
        assertThat(restarted.scanner.scan()).isEqualTo(1);

        PositionSnapshot position = restarted.positionBook.getPosition(SYMBOL, TradingMode.SIMULATED);
        assertThat(position.getQuantity()).isEqualTo(15);
        // buy limit fills at the lower market price: (10 x 1000 + 5 x 940) / 15
        assertThat(position.getAveragePrice()).isEqualByComparingTo("980");
        assertThat(position.getOpenLots()).hasSize(2);
        assertThat(ledgerStore.findOrder(resting.getId()))
                .hasValueSatisfying(order -> assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED));
    }

    @Test
    @DisplayName("Expired orders are closed out and persisted without touching the book")
    void expiryFlow() {
        services.marketData.updatePrice(SYMBOL, new BigDecimal("1000"));
        LocalDateTime expiresAt = LocalDateTime.now().plusMinutes(5);
        Order resting = services.oms.place(OrderRequest.builder()
                .symbol(SYMBOL)
                .side(OrderSide.BUY)
                .type(OrderType.LIMIT)
                .quantity(10)
                .limitPrice(new BigDecimal("900"))
                .expiresAt(expiresAt)
                .build());

        int expired = new OrderExpiryMonitor(services.oms).expireDue(expiresAt.plusSeconds(1));

        assertThat(expired).isEqualTo(1);
        assertThat(services.oms.getActiveOrders()).isEmpty();
        assertThat(ledgerStore.findOrder(resting.getId())).hasValueSatisfying(order -> {
            assertThat(order.getStatus()).isEqualTo(OrderStatus.EXPIRED);
            assertThat(order.getRemainingQuantity()).isEqualTo(10);
        });
        assertThat(services.positionBook.getPosition(SYMBOL, TradingMode.SIMULATED).getQuantity())
                .isZero();
        assertThat(services.portfolio.cash(TradingMode.SIMULATED)).isEqualByComparingTo(INITIAL_CAPITAL);
    }

    private static OrderRequest request(OrderSide side, OrderType type, int quantity, BigDecimal limitPrice) {
        return OrderRequest.builder()
                .symbol(SYMBOL)
                .side(side)
                .type(type)
                .quantity(quantity)
                .limitPrice(limitPrice)
                .build();
    }

    /** One application's worth of services over a shared store. */
    private static final class Services {

        final MarketDataService marketData;
        final PositionBook positionBook;
        final PortfolioService portfolio;
        final OrderLifecycleManager oms;
        final PendingOrderScanner scanner;
        final LedgerRecoveryService recovery;

        Services(InMemoryLedgerStore store) {
            EventPublisherHelper events = mock(EventPublisherHelper.class);
            ChargeCalculator charges = new ChargeCalculator(new BigDecimal("0.0015"), new BigDecimal("0.001"));
            RiskMetricsCalculator calculator = new RiskMetricsCalculator();
            RiskLimitsHolder limits = new RiskLimitsHolder(RiskLimits.defaults());

            marketData = new MarketDataService(events, 500);
            positionBook = new PositionBook(charges, events);
            portfolio = new PortfolioService(positionBook, INITIAL_CAPITAL);
            RiskMetricsService riskMetrics = new RiskMetricsService(calculator, marketData, portfolio, limits, 252);
            RiskGate riskGate = new RiskGate(positionBook, portfolio, riskMetrics, calculator, limits, events);
            oms = new OrderLifecycleManager(
                    riskGate,
                    new ExecutionSimulator(charges, 0, 0),
                    positionBook,
                    portfolio,
                    marketData,
                    store,
                    events,
                    TradingMode.SIMULATED,
                    false,
                    false);
            scanner = new PendingOrderScanner(oms, mock(TaskScheduler.class), 1000);
            recovery = new LedgerRecoveryService(store, positionBook, portfolio, oms);
        }
    }
}
