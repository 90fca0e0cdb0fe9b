package com.tradedesk.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.Trade;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.exception.ConcurrencyConflictException;
import com.tradedesk.exception.InvalidStateException;
import com.tradedesk.exception.PersistenceException;
import com.tradedesk.exception.PriceUnavailableException;
import com.tradedesk.exception.ResourceNotFoundException;
import com.tradedesk.exception.RiskLimitExceededException;
import com.tradedesk.exception.ValidationException;
import com.tradedesk.ledger.PositionBook;
import com.tradedesk.marketdata.MarketDataService;
import com.tradedesk.oms.OrderLifecycleManager;
import com.tradedesk.oms.OrderRequest;
import com.tradedesk.persistence.LedgerStore;
import com.tradedesk.pnl.ChargeCalculator;
import com.tradedesk.portfolio.PortfolioService;
import com.tradedesk.risk.RiskGate;
import com.tradedesk.risk.RiskLimits;
import com.tradedesk.risk.RiskLimitsHolder;
import com.tradedesk.risk.RiskMetricsCalculator;
import com.tradedesk.risk.RiskMetricsService;
import com.tradedesk.simulator.ExecutionSimulator;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Unit tests for OrderLifecycleManager with the real book, portfolio, simulator and risk
 * gate. Only the ledger store, event publishing and return series are mocked.
 */
@ExtendWith(MockitoExtension.class)
class OrderLifecycleManagerTest {

    private static final String SYMBOL = "AAPL";

    @Mock
    private LedgerStore ledgerStore;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private RiskMetricsService riskMetricsService;

    private ChargeCalculator chargeCalculator;
    private PositionBook positionBook;
    private PortfolioService portfolioService;
    private MarketDataService marketDataService;
    private RiskLimitsHolder riskLimitsHolder;
    private RiskGate riskGate;

    @BeforeEach
    void setUp() {
        chargeCalculator = new ChargeCalculator(new BigDecimal("0.0015"), new BigDecimal("0.001"));
        positionBook = new PositionBook(chargeCalculator, eventPublisherHelper);
        portfolioService = new PortfolioService(positionBook, new BigDecimal("100000"));
        marketDataService = new MarketDataService(eventPublisherHelper, 500);
        riskLimitsHolder = new RiskLimitsHolder(RiskLimits.defaults());
        riskGate = new RiskGate(
                positionBook,
                portfolioService,
                riskMetricsService,
                new RiskMetricsCalculator(),
                riskLimitsHolder,
                eventPublisherHelper);

        lenient().when(riskMetricsService.symbolReturns(anyString(), anyInt())).thenReturn(new double[0]);
    }

    private OrderLifecycleManager manager(int maxFillQuantity) {
        return new OrderLifecycleManager(
                riskGate,
                new ExecutionSimulator(chargeCalculator, 0, maxFillQuantity),
                positionBook,
                portfolioService,
                marketDataService,
                ledgerStore,
                eventPublisherHelper,
                TradingMode.SIMULATED,
                false,
                false);
    }

    @Nested
    @DisplayName("Placement")
    class Placement {

        @Test
        @DisplayName("A simulated market order fills immediately")
        void marketOrderFills() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
            OrderLifecycleManager oms = manager(0);

            Order order = oms.place(marketOrder(OrderSide.BUY, 10));

            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(order.getFilledQuantity()).isEqualTo(10);
            assertThat(order.getRemainingQuantity()).isZero();
            assertThat(order.getAverageFillPrice()).isEqualByComparingTo("100");
            assertThat(order.getFilledAt()).isNotNull();
            assertThat(positionBook.getPosition(SYMBOL, TradingMode.SIMULATED).getQuantity()).isEqualTo(10);
            // 1000 turnover + 2.50 fees
            assertThat(portfolioService.cash(TradingMode.SIMULATED)).isEqualByComparingTo("98997.50");
            verify(ledgerStore).saveFill(any(), any());
            verify(eventPublisherHelper).publishOrderSubmitted(eq(oms), any());
            verify(eventPublisherHelper).publishOrderFilled(eq(oms), any(), eq(OrderStatus.SUBMITTED), any());
        }

        @Test
        @DisplayName("Symbols are normalized to upper case")
        void normalizesSymbol() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));

            Order order = manager(0).place(OrderRequest.builder()
                    .symbol(" aapl ")
                    .side(OrderSide.BUY)
                    .type(OrderType.MARKET)
                    .quantity(1)
                    .build());

            assertThat(order.getSymbol()).isEqualTo(SYMBOL);
        }

        @Test
        @DisplayName("A limit order away from the market rests as SUBMITTED")
        void limitOrderRests() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
            OrderLifecycleManager oms = manager(0);

            Order order = oms.place(limitOrder(OrderSide.BUY, 10, "95"));

            assertThat(order.getStatus()).isEqualTo(OrderStatus.SUBMITTED);
            assertThat(order.getSubmittedAt()).isNotNull();
            assertThat(oms.getActiveOrders()).extracting(Order::getId).containsExactly(order.getId());
            verify(ledgerStore, never()).saveFill(any(), any());
        }

        @Test
        @DisplayName("Without a market price the order stays SUBMITTED")
        void noPrice() {
            OrderLifecycleManager oms = manager(0);

            Order order = oms.place(marketOrder(OrderSide.BUY, 10));

            assertThat(order.getStatus()).isEqualTo(OrderStatus.SUBMITTED);
            assertThatThrownBy(() -> oms.attemptExecution(order.getId()))
                    .isInstanceOf(PriceUnavailableException.class);
            assertThat(oms.getOrder(order.getId()).getStatus()).isEqualTo(OrderStatus.SUBMITTED);
        }

        @Test
        @DisplayName("A risk denial rejects the order with the violated limit as reason")
        void riskRejection() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
            OrderLifecycleManager oms = manager(0);

            assertThatThrownBy(() -> oms.place(marketOrder(OrderSide.BUY, 200)))
                    .isInstanceOf(RiskLimitExceededException.class);

            ArgumentCaptor<Order> saved = ArgumentCaptor.forClass(Order.class);
            verify(ledgerStore).saveOrder(saved.capture());
            assertThat(saved.getValue().getStatus()).isEqualTo(OrderStatus.REJECTED);
            assertThat(saved.getValue().getRejectionReason()).startsWith("POSITION_SIZE_EXCEEDED");
            assertThat(saved.getValue().getRemainingQuantity()).isEqualTo(200);
            assertThat(positionBook.getPosition(SYMBOL, TradingMode.SIMULATED).getQuantity()).isZero();
            verify(eventPublisherHelper).publishOrderRejected(eq(oms), any(), eq(OrderStatus.PENDING));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Quantity must be positive")
        void quantity() {
            assertThatThrownBy(() -> manager(0).place(marketOrder(OrderSide.BUY, 0)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("LIMIT requires a limit price and STOP_LOSS a stop price")
        void requiredPrices() {
            OrderLifecycleManager oms = manager(0);

            assertThatThrownBy(() -> oms.place(OrderRequest.builder()
                            .symbol(SYMBOL)
                            .side(OrderSide.BUY)
                            .type(OrderType.LIMIT)
                            .quantity(1)
                            .build()))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> oms.place(OrderRequest.builder()
                            .symbol(SYMBOL)
                            .side(OrderSide.SELL)
                            .type(OrderType.STOP_LOSS)
                            .quantity(1)
                            .build()))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Missing symbol or non-positive limit price are rejected before anything is stored")
        void malformed() {
            OrderLifecycleManager oms = manager(0);

            assertThatThrownBy(() -> oms.place(OrderRequest.builder()
                            .symbol(" ")
                            .side(OrderSide.BUY)
                            .type(OrderType.MARKET)
                            .quantity(1)
                            .build()))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> oms.place(limitOrder(OrderSide.BUY, 1, "-5")))
                    .isInstanceOf(ValidationException.class);
            verify(ledgerStore, never()).saveOrder(any());
        }
    }

    @Nested
    @DisplayName("Partial fills")
    class PartialFills {

        @Test
        @DisplayName("Fills accumulate with a volume-weighted average price")
        void vwap() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
            OrderLifecycleManager oms = manager(3);

            Order order = oms.place(marketOrder(OrderSide.BUY, 10));
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
            assertThat(order.getFilledQuantity()).isEqualTo(3);

            marketDataService.updatePrice(SYMBOL, new BigDecimal("110"));
            oms.attemptExecution(order.getId());
            assertThat(oms.getOrder(order.getId()).getAverageFillPrice()).isEqualByComparingTo("105");

            marketDataService.updatePrice(SYMBOL, new BigDecimal("120"));
            oms.attemptExecution(order.getId());
            Optional<Trade> last = oms.attemptExecution(order.getId());

            Order filled = oms.getOrder(order.getId());
            assertThat(last).isPresent();
            assertThat(last.get().getQuantity()).isEqualTo(1);
            assertThat(filled.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(filled.getFilledQuantity() + filled.getRemainingQuantity()).isEqualTo(10);
            // (300 + 330 + 360 + 120) / 10
            assertThat(filled.getAverageFillPrice()).isEqualByComparingTo("111");
            assertThat(positionBook.getPosition(SYMBOL, TradingMode.SIMULATED).getQuantity()).isEqualTo(10);
        }

        @Test
        @DisplayName("Cancelling a partially filled order keeps the filled part booked")
        void cancelPartial() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
            OrderLifecycleManager oms = manager(3);
            Order order = oms.place(marketOrder(OrderSide.BUY, 10));

            Order cancelled = oms.cancel(order.getId());

            assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(cancelled.getFilledQuantity()).isEqualTo(3);
            assertThat(cancelled.getRemainingQuantity()).isEqualTo(7);
            assertThat(cancelled.getCancelledAt()).isNotNull();
            assertThat(positionBook.getPosition(SYMBOL, TradingMode.SIMULATED).getQuantity()).isEqualTo(3);
            assertThat(oms.getActiveOrders()).isEmpty();
            verify(eventPublisherHelper)
                    .publishOrderCancelled(eq(oms), any(), eq(OrderStatus.PARTIALLY_FILLED));
        }

        @Test
        @DisplayName("Re-attempts are risk checked on the remaining quantity only")
        void retryNearLimit() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
            OrderLifecycleManager oms = manager(40);
            Order order = oms.place(marketOrder(OrderSide.BUY, 80));
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
            assertThat(order.getFilledQuantity()).isEqualTo(40);

            // 40 held + 40 remaining is 8% of the portfolio, the full 80 again would be 12%
            Optional<Trade> second = oms.attemptExecution(order.getId());

            assertThat(second).isPresent();
            assertThat(oms.getOrder(order.getId()).getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(positionBook.getPosition(SYMBOL, TradingMode.SIMULATED).getQuantity()).isEqualTo(80);
            verify(eventPublisherHelper, never()).publishOrderRejected(any(), any(), any());
        }

        @Test
        @DisplayName("A partially filled closing sell still counts as reducing")
        void partialCloseStaysReducing() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
            manager(0).place(marketOrder(OrderSide.BUY, 80));
            riskLimitsHolder.replace(RiskLimits.builder()
                    .maxPositionFraction(new BigDecimal("0.001"))
                    .maxConcentrationFraction(new BigDecimal("0.001"))
                    .build());
            OrderLifecycleManager oms = manager(40);

            Order sell = oms.place(marketOrder(OrderSide.SELL, 80));
            assertThat(sell.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
            assertThat(oms.attemptExecution(sell.getId())).isPresent();

            assertThat(oms.getOrder(sell.getId()).getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(positionBook.getPosition(SYMBOL, TradingMode.SIMULATED).getQuantity()).isZero();
        }
    }

    @Nested
    @DisplayName("Terminal states")
    class TerminalStates {

        @Test
        @DisplayName("Cancelling a filled order fails and leaves it FILLED")
        void cancelFilled() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
            OrderLifecycleManager oms = manager(0);
            Order order = oms.place(marketOrder(OrderSide.BUY, 10));

            assertThatThrownBy(() -> oms.cancel(order.getId())).isInstanceOf(InvalidStateException.class);

            assertThat(oms.getOrder(order.getId()).getStatus()).isEqualTo(OrderStatus.FILLED);
            verify(eventPublisherHelper, never()).publishOrderCancelled(any(), any(), any());
        }

        @Test
        @DisplayName("A second cancel fails and leaves the first cancellation intact")
        void cancelTwice() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
            OrderLifecycleManager oms = manager(0);
            Order order = oms.place(limitOrder(OrderSide.BUY, 10, "90"));
            Order cancelled = oms.cancel(order.getId());

            assertThatThrownBy(() -> oms.cancel(order.getId())).isInstanceOf(InvalidStateException.class);

            Order after = oms.getOrder(order.getId());
            assertThat(after.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(after.getCancelledAt()).isEqualTo(cancelled.getCancelledAt());
            verify(eventPublisherHelper, times(1)).publishOrderCancelled(eq(oms), any(), eq(OrderStatus.SUBMITTED));
        }

        @Test
        @DisplayName("Executing a cancelled order fails")
        void executeCancelled() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
            OrderLifecycleManager oms = manager(0);
            Order order = oms.place(limitOrder(OrderSide.BUY, 10, "90"));
            oms.cancel(order.getId());

            assertThatThrownBy(() -> oms.attemptExecution(order.getId()))
                    .isInstanceOf(InvalidStateException.class);
            assertThatThrownBy(() -> oms.expire(order.getId())).isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("Expiring moves a resting order to EXPIRED")
        void expire() {
            marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
            OrderLifecycleManager oms = manager(0);
            Order order = oms.place(limitOrder(OrderSide.BUY, 10, "90"));

            Order expired = oms.expire(order.getId());

            assertThat(expired.getStatus()).isEqualTo(OrderStatus.EXPIRED);
            assertThat(expired.getCancelledAt()).isNull();
            verify(eventPublisherHelper).publishOrderExpired(eq(oms), any(), eq(OrderStatus.SUBMITTED));
        }
    }

    @Test
    @DisplayName("A failed fill write leaves order, position and cash untouched")
    void persistenceFailure() {
        marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
        OrderLifecycleManager oms = manager(0);
        Order order = oms.place(limitOrder(OrderSide.BUY, 10, "95"));
        doThrow(new DataAccessResourceFailureException("connection lost"))
                .when(ledgerStore)
                .saveFill(any(), any());

        marketDataService.updatePrice(SYMBOL, new BigDecimal("94"));

        assertThatThrownBy(() -> oms.attemptExecution(order.getId()))
                .isInstanceOf(PersistenceException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        Order after = oms.getOrder(order.getId());
        assertThat(after.getStatus()).isEqualTo(OrderStatus.SUBMITTED);
        assertThat(after.getFilledQuantity()).isZero();
        assertThat(positionBook.getPosition(SYMBOL, TradingMode.SIMULATED).getQuantity()).isZero();
        assertThat(portfolioService.cash(TradingMode.SIMULATED)).isEqualByComparingTo("100000");
        verify(eventPublisherHelper, never()).publishOrderFilled(any(), any(), any(), any());
    }

    @Test
    @DisplayName("A cancel racing an in-flight fill is refused")
    void concurrentCancel() throws Exception {
        marketDataService.updatePrice(SYMBOL, new BigDecimal("100"));
        OrderLifecycleManager oms = manager(0);
        Order order = oms.place(limitOrder(OrderSide.BUY, 10, "95"));

        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
                    writing.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return null;
                })
                .when(ledgerStore)
                .saveFill(any(), any());

        marketDataService.updatePrice(SYMBOL, new BigDecimal("94"));
        CompletableFuture<Optional<Trade>> fill = CompletableFuture.supplyAsync(() -> oms.attemptExecution(order.getId()));
        assertThat(writing.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> oms.cancel(order.getId())).isInstanceOf(ConcurrencyConflictException.class);

        release.countDown();
        assertThat(fill.get(5, TimeUnit.SECONDS)).isPresent();
        assertThat(oms.getOrder(order.getId()).getStatus()).isEqualTo(OrderStatus.FILLED);
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Unknown orders are reported as not found")
        void unknownOrder() {
            assertThatThrownBy(() -> manager(0).getOrder("missing")).isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Orders known only to the store are served from it")
        void storeFallback() {
            Order stored = Order.builder()
                    .id("ord-old")
                    .symbol(SYMBOL)
                    .type(OrderType.MARKET)
                    .side(OrderSide.BUY)
                    .quantity(5)
                    .mode(TradingMode.SIMULATED)
                    .status(OrderStatus.FILLED)
                    .filledQuantity(5)
                    .build();
            when(ledgerStore.findOrder("ord-old")).thenReturn(Optional.of(stored));

            assertThat(manager(0).getOrder("ord-old").getStatus()).isEqualTo(OrderStatus.FILLED);
        }

        @Test
        @DisplayName("History defaults to 50 entries and normalizes the symbol")
        void history() {
            when(ledgerStore.findOrderHistory(SYMBOL, null, OrderLifecycleManager.DEFAULT_HISTORY_LIMIT))
                    .thenReturn(List.of());

            assertThat(manager(0).getOrderHistory("aapl", null, 0)).isEmpty();
        }

        @Test
        @DisplayName("Trade history passes mode and explicit limit through")
        void tradeHistory() {
            Trade trade = Trade.builder().id("trd-1").symbol(SYMBOL).mode(TradingMode.LIVE).build();
            when(ledgerStore.findTradeHistory(SYMBOL, TradingMode.LIVE, 5)).thenReturn(List.of(trade));

            assertThat(manager(0).getTradeHistory(" aapl ", TradingMode.LIVE, 5)).containsExactly(trade);
        }

        @Test
        @DisplayName("Trade history without filters uses the default limit")
        void tradeHistoryDefaults() {
            when(ledgerStore.findTradeHistory(null, null, OrderLifecycleManager.DEFAULT_HISTORY_LIMIT))
                    .thenReturn(List.of());

            assertThat(manager(0).getTradeHistory(null, null, -1)).isEmpty();
        }
    }

    @Test
    @DisplayName("Switching to LIVE requires live trading to be enabled")
    void tradingMode() {
        OrderLifecycleManager oms = manager(0);

        assertThatThrownBy(() -> oms.switchTradingMode(TradingMode.LIVE)).isInstanceOf(ValidationException.class);
        assertThat(oms.getTradingMode()).isEqualTo(TradingMode.SIMULATED);

        OrderLifecycleManager liveCapable = new OrderLifecycleManager(
                riskGate,
                new ExecutionSimulator(chargeCalculator, 0, 0),
                positionBook,
                portfolioService,
                marketDataService,
                ledgerStore,
                eventPublisherHelper,
                TradingMode.SIMULATED,
                false,
                true);
        assertThat(liveCapable.switchTradingMode(TradingMode.LIVE)).isEqualTo(TradingMode.SIMULATED);
        assertThat(liveCapable.getTradingMode()).isEqualTo(TradingMode.LIVE);
    }

    private static OrderRequest marketOrder(OrderSide side, int quantity) {
        return OrderRequest.builder()
                .symbol(SYMBOL)
                .side(side)
                .type(OrderType.MARKET)
                .quantity(quantity)
                .build();
    }

    private static OrderRequest limitOrder(OrderSide side, int quantity, String limit) {
        return OrderRequest.builder()
                .symbol(SYMBOL)
                .side(side)
                .type(OrderType.LIMIT)
                .quantity(quantity)
                .limitPrice(new BigDecimal(limit))
                .build();
    }
}
