package com.tradedesk.oms;

import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.FillDecision;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.PositionUpdate;
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
import com.tradedesk.persistence.LedgerStore;
import com.tradedesk.portfolio.PortfolioService;
import com.tradedesk.risk.RiskCheckResult;
import com.tradedesk.risk.RiskGate;
import com.tradedesk.risk.RiskViolation;
import com.tradedesk.simulator.ExecutionSimulator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Owns the order state machine and drives an order from placement to its terminal state.
 *
 * <p>Flow: validate, risk gate, submit, then on each execution attempt re-check risk at
 * the market price, ask the {@link ExecutionSimulator} for a fill and apply the resulting
 * trade to the {@link PositionBook}. The position, lots, trade, order, cash and daily P&L of
 * a fill are committed together: the durable write runs inside the book's commit callback,
 * so a failed write leaves both the book and the order untouched.
 *
 * <pre>
 * PENDING -> SUBMITTED | REJECTED
 * SUBMITTED -> PARTIALLY_FILLED | FILLED | CANCELLED | EXPIRED | REJECTED
 * PARTIALLY_FILLED -> PARTIALLY_FILLED | FILLED | CANCELLED | EXPIRED | REJECTED
 * </pre>
 *
 * <p>Every transition on an existing order first claims the order id. A second caller that
 * finds the id claimed fails fast with {@link ConcurrencyConflictException} instead of
 * waiting, so a cancel racing a fill has exactly one winner.
 */
@Service
public class OrderLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleManager.class);

    public static final int DEFAULT_HISTORY_LIMIT = 50;

    static final int PRICE_SCALE = 4;

    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private final RiskGate riskGate;
    private final ExecutionSimulator executionSimulator;
    private final PositionBook positionBook;
    private final PortfolioService portfolioService;
    private final MarketDataService marketDataService;
    private final LedgerStore ledgerStore;
    private final EventPublisherHelper eventPublisherHelper;

    private final boolean autoTrading;
    private final boolean liveEnabled;
    private volatile TradingMode tradingMode;

    public OrderLifecycleManager(
            RiskGate riskGate,
            ExecutionSimulator executionSimulator,
            PositionBook positionBook,
            PortfolioService portfolioService,
            MarketDataService marketDataService,
            LedgerStore ledgerStore,
            EventPublisherHelper eventPublisherHelper,
            @Value("${tradedesk.trading.default-mode:SIMULATED}") TradingMode tradingMode,
            @Value("${tradedesk.trading.auto-trading:false}") boolean autoTrading,
            @Value("${tradedesk.trading.live-enabled:false}") boolean liveEnabled) {
        this.riskGate = riskGate;
        this.executionSimulator = executionSimulator;
        this.positionBook = positionBook;
        this.portfolioService = portfolioService;
        this.marketDataService = marketDataService;
        this.ledgerStore = ledgerStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.tradingMode = tradingMode;
        this.autoTrading = autoTrading;
        this.liveEnabled = liveEnabled;
    }

    // ---- Placement ----

    /**
     * Validates and submits a new order.
     *
     * <p>The risk gate runs at placement against the market price, falling back to the limit
     * and then the stop price; with no reference price at all it is deferred to execution.
     * In SIMULATED mode, or with auto-trading on, execution is attempted right away; a missing
     * market price then simply leaves the order SUBMITTED.
     *
     * @return a copy of the order after placement (and any immediate fill)
     * @throws ValidationException if the request is malformed
     * @throws RiskLimitExceededException if the gate denies the order; the order is REJECTED
     */
    public Order place(OrderRequest request) {
        validate(request);

        LocalDateTime now = LocalDateTime.now();
        TradingMode mode = request.getMode() != null ? request.getMode() : tradingMode;
        Order order = Order.builder()
                .id(UUID.randomUUID().toString())
                .symbol(MarketDataService.normalize(request.getSymbol()))
                .type(request.getType())
                .side(request.getSide())
                .quantity(request.getQuantity())
                .limitPrice(request.getLimitPrice())
                .stopPrice(request.getStopPrice())
                .mode(mode)
                .status(OrderStatus.PENDING)
                .filledQuantity(0)
                .remainingQuantity(request.getQuantity())
                .createdAt(now)
                .expiresAt(request.getExpiresAt())
                .updatedAt(now)
                .build();

        Optional<BigDecimal> referencePrice = referencePrice(order);
        if (referencePrice.isPresent()) {
            RiskCheckResult result = riskGate.check(order, referencePrice.get());
            if (result.isDenied()) {
                reject(order, result.getViolation());
                throw new RiskLimitExceededException(result.getViolation());
            }
        } else {
            log.info(
                    "No reference price for {}, risk check deferred to execution: order={}",
                    order.getSymbol(),
                    order.getId());
        }

        order.setStatus(OrderStatus.SUBMITTED);
        order.setSubmittedAt(now);
        persist(order, () -> ledgerStore.saveOrder(order));
        orders.put(order.getId(), order);

        log.info(
                "Order submitted: id={} symbol={} side={} type={} qty={} mode={}",
                order.getId(),
                order.getSymbol(),
                order.getSide(),
                order.getType(),
                order.getQuantity(),
                order.getMode());
        eventPublisherHelper.publishOrderSubmitted(this, order.copy());

        if (mode == TradingMode.SIMULATED || autoTrading) {
            try {
                attemptExecution(order.getId());
            } catch (PriceUnavailableException e) {
                log.info("Order {} stays SUBMITTED: {}", order.getId(), e.getMessage());
            }
        }
        return getOrder(order.getId());
    }

    // ---- Execution ----

    /**
     * Tries to fill the order at the current market price.
     *
     * @return the trade created by the fill, or empty if the price does not cross the order's
     *     conditions (the order is left as it was)
     * @throws PriceUnavailableException if there is no market price; nothing changes
     * @throws ConcurrencyConflictException if another transition on the order is in flight
     * @throws InvalidStateException if the order is not SUBMITTED or PARTIALLY_FILLED
     * @throws RiskLimitExceededException if the gate denies at the market price; the order is REJECTED
     * @throws PersistenceException if the fill cannot be stored; order and position are unchanged
     */
    public Optional<Trade> attemptExecution(String orderId) {
        Order current = requireOrder(orderId);
        BigDecimal marketPrice = marketDataService
                .getCurrentPrice(current.getSymbol())
                .orElseThrow(() -> new PriceUnavailableException(current.getSymbol()));

        claim(orderId, "execute");
        try {
            Order order = claimed(orderId);
            if (!order.getStatus().isFillable()) {
                throw new InvalidStateException(orderId, order.getStatus(), "execute");
            }

            RiskCheckResult result = riskGate.check(order, marketPrice);
            if (result.isDenied()) {
                reject(order.copy(), result.getViolation());
                throw new RiskLimitExceededException(result.getViolation());
            }

            Optional<FillDecision> decision = executionSimulator.decide(order, marketPrice);
            if (decision.isEmpty()) {
                log.debug(
                        "No fill: order={} type={} market={} limit={} stop={}",
                        orderId,
                        order.getType(),
                        marketPrice,
                        order.getLimitPrice(),
                        order.getStopPrice());
                return Optional.empty();
            }
            return Optional.of(fill(order, decision.get()));
        } finally {
            release(orderId);
        }
    }

    private Trade fill(Order order, FillDecision decision) {
        LocalDateTime now = LocalDateTime.now();
        Trade trade = Trade.builder()
                .id(UUID.randomUUID().toString())
                .orderId(order.getId())
                .symbol(order.getSymbol())
                .mode(order.getMode())
                .side(order.getSide())
                .quantity(decision.getQuantity())
                .fillPrice(decision.getFillPrice())
                .charges(decision.getCharges())
                .realizedPnl(BigDecimal.ZERO)
                .executedAt(now)
                .build();

        OrderStatus previousStatus = order.getStatus();
        Order filled = order.copy();
        int filledBefore = order.getFilledQuantity();
        int filledAfter = filledBefore + decision.getQuantity();
        filled.setAverageFillPrice(vwap(order.getAverageFillPrice(), filledBefore, decision));
        filled.setFilledQuantity(filledAfter);
        filled.setRemainingQuantity(order.getQuantity() - filledAfter);
        filled.setUpdatedAt(now);
        if (filled.getRemainingQuantity() == 0) {
            filled.setStatus(OrderStatus.FILLED);
            filled.setFilledAt(now);
        } else {
            filled.setStatus(OrderStatus.PARTIALLY_FILLED);
        }

        PositionUpdate update = positionBook.apply(trade, committed -> {
            persist(filled, () -> ledgerStore.saveFill(filled, committed));
            portfolioService.applyFill(committed);
        });
        orders.put(filled.getId(), filled);

        log.info(
                "Order {}: id={} fillQty={} fillPrice={} filled={}/{} avg={} realized={}",
                filled.getStatus(),
                filled.getId(),
                trade.getQuantity(),
                trade.getFillPrice(),
                filled.getFilledQuantity(),
                filled.getQuantity(),
                filled.getAverageFillPrice(),
                update.getRealizedPnl());
        eventPublisherHelper.publishOrderFilled(this, filled.copy(), previousStatus, update.getTrade());
        return update.getTrade();
    }

    private BigDecimal vwap(BigDecimal previousAverage, int previousFilled, FillDecision decision) {
        if (previousAverage == null || previousFilled == 0) {
            return decision.getFillPrice();
        }
        BigDecimal previousValue = previousAverage.multiply(BigDecimal.valueOf(previousFilled));
        BigDecimal fillValue = decision.getFillPrice().multiply(BigDecimal.valueOf(decision.getQuantity()));
        return previousValue
                .add(fillValue)
                .divide(BigDecimal.valueOf(previousFilled + decision.getQuantity()), PRICE_SCALE, RoundingMode.HALF_UP);
    }

    // ---- Cancel / expire ----

    /**
     * Cancels an active order. The filled part of a partially filled order stays booked.
     *
     * @throws InvalidStateException if the order is FILLED or already terminal; nothing changes
     * @throws ConcurrencyConflictException if a fill on the same order is in flight
     */
    public Order cancel(String orderId) {
        return terminate(orderId, OrderStatus.CANCELLED, "cancel");
    }

    /** Moves an active order past its good-till time to EXPIRED. */
    public Order expire(String orderId) {
        return terminate(orderId, OrderStatus.EXPIRED, "expire");
    }

    private Order terminate(String orderId, OrderStatus target, String operation) {
        requireOrder(orderId);
        claim(orderId, operation);
        try {
            Order order = claimed(orderId);
            if (!order.getStatus().isCancellable()) {
                throw new InvalidStateException(orderId, order.getStatus(), operation);
            }

            OrderStatus previousStatus = order.getStatus();
            LocalDateTime now = LocalDateTime.now();
            Order terminated = order.copy();
            terminated.setStatus(target);
            terminated.setUpdatedAt(now);
            if (target == OrderStatus.CANCELLED) {
                terminated.setCancelledAt(now);
            }
            persist(terminated, () -> ledgerStore.saveOrder(terminated));
            orders.put(orderId, terminated);

            log.info(
                    "Order {}: id={} previous={} filled={}/{}",
                    target,
                    orderId,
                    previousStatus,
                    terminated.getFilledQuantity(),
                    terminated.getQuantity());
            if (target == OrderStatus.CANCELLED) {
                eventPublisherHelper.publishOrderCancelled(this, terminated.copy(), previousStatus);
            } else {
                eventPublisherHelper.publishOrderExpired(this, terminated.copy(), previousStatus);
            }
            return terminated.copy();
        } finally {
            release(orderId);
        }
    }

    private void reject(Order order, RiskViolation violation) {
        OrderStatus previousStatus = order.getStatus();
        order.setStatus(OrderStatus.REJECTED);
        order.setRejectionReason(violation.toString());
        order.setUpdatedAt(LocalDateTime.now());
        persist(order, () -> ledgerStore.saveOrder(order));
        orders.put(order.getId(), order);

        log.info("Order REJECTED: id={} previous={} reason={}", order.getId(), previousStatus, violation);
        eventPublisherHelper.publishOrderRejected(this, order.copy(), previousStatus);
    }

    // ---- Queries ----

    public Order getOrder(String orderId) {
        return requireOrder(orderId).copy();
    }

    /** Newest first. Null symbol or mode matches all. */
    public List<Order> getOrderHistory(String symbol, TradingMode mode, int limit) {
        String normalized = symbol != null ? MarketDataService.normalize(symbol) : null;
        return ledgerStore.findOrderHistory(normalized, mode, limit > 0 ? limit : DEFAULT_HISTORY_LIMIT);
    }

    /** Executions across all orders, newest first. */
    public List<Trade> getTradeHistory(String symbol, TradingMode mode, int limit) {
        String normalized = symbol != null ? MarketDataService.normalize(symbol) : null;
        return ledgerStore.findTradeHistory(normalized, mode, limit > 0 ? limit : DEFAULT_HISTORY_LIMIT);
    }

    public List<Trade> getTrades(String orderId) {
        requireOrder(orderId);
        return ledgerStore.findTrades(orderId);
    }

    /** SUBMITTED and PARTIALLY_FILLED orders, oldest first. */
    public List<Order> getActiveOrders() {
        return orders.values().stream()
                .filter(order -> order.getStatus().isFillable())
                .sorted(Comparator.comparing(Order::getCreatedAt))
                .map(Order::copy)
                .toList();
    }

    // ---- Trading mode ----

    public TradingMode getTradingMode() {
        return tradingMode;
    }

    /**
     * Changes the default mode for orders placed without one.
     *
     * @throws ValidationException when switching to LIVE while live trading is disabled
     */
    public TradingMode switchTradingMode(TradingMode mode) {
        if (mode == null) {
            throw new ValidationException("mode", "Trading mode is required");
        }
        if (mode == TradingMode.LIVE && !liveEnabled) {
            throw new ValidationException("mode", "Live trading is not enabled");
        }
        TradingMode previous = tradingMode;
        tradingMode = mode;
        log.info("Trading mode switched: {} -> {}", previous, mode);
        return previous;
    }

    /** Reinstalls persisted non-terminal orders. Used on startup recovery. */
    public void restoreOrders(List<Order> restored) {
        for (Order order : restored) {
            orders.put(order.getId(), order.copy());
        }
        log.info("Restored {} active orders", restored.size());
    }

    // ---- Internals ----

    private void validate(OrderRequest request) {
        if (request.getSymbol() == null || request.getSymbol().isBlank()) {
            throw new ValidationException("symbol", "Symbol is required");
        }
        if (request.getSide() == null) {
            throw new ValidationException("side", "Order side is required");
        }
        if (request.getType() == null) {
            throw new ValidationException("type", "Order type is required");
        }
        if (request.getQuantity() <= 0) {
            throw new ValidationException("quantity", "Quantity must be positive, got " + request.getQuantity());
        }
        if (request.getType().requiresLimitPrice() && request.getLimitPrice() == null) {
            throw new ValidationException("limitPrice", request.getType() + " order requires a limit price");
        }
        if (request.getType().requiresStopPrice() && request.getStopPrice() == null) {
            throw new ValidationException("stopPrice", request.getType() + " order requires a stop price");
        }
        if (request.getLimitPrice() != null && request.getLimitPrice().signum() <= 0) {
            throw new ValidationException("limitPrice", "Limit price must be positive");
        }
        if (request.getStopPrice() != null && request.getStopPrice().signum() <= 0) {
            throw new ValidationException("stopPrice", "Stop price must be positive");
        }
    }

    private Optional<BigDecimal> referencePrice(Order order) {
        Optional<BigDecimal> market = marketDataService.getCurrentPrice(order.getSymbol());
        if (market.isPresent()) {
            return market;
        }
        if (order.getLimitPrice() != null) {
            return Optional.of(order.getLimitPrice());
        }
        return Optional.ofNullable(order.getStopPrice());
    }

    private Order requireOrder(String orderId) {
        Order order = orders.get(orderId);
        if (order != null) {
            return order;
        }
        return ledgerStore.findOrder(orderId).orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }

    private void claim(String orderId, String operation) {
        if (!inFlight.add(orderId)) {
            log.warn("Concurrent {} on order {} refused", operation, orderId);
            throw new ConcurrencyConflictException(orderId, operation);
        }
    }

    /** The claimed order. Terminal orders known only to the store are loaded so the state check sees them. */
    private Order claimed(String orderId) {
        Order order = orders.get(orderId);
        if (order == null) {
            order = ledgerStore.findOrder(orderId).orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
            orders.put(orderId, order);
        }
        return order;
    }

    private void release(String orderId) {
        inFlight.remove(orderId);
    }

    private void persist(Order order, Runnable write) {
        try {
            write.run();
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to persist order {}: {}", order.getId(), e.getMessage(), e);
            throw new PersistenceException(
                    "Failed to persist order " + order.getId(),
                    Map.of("orderId", order.getId(), "status", order.getStatus().name()),
                    e);
        }
    }
}
