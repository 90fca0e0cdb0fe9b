package com.tradedesk.persistence;

import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.Lot;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.Position;
import com.tradedesk.domain.model.PositionUpdate;
import com.tradedesk.domain.model.Trade;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for orders, trades, lots and positions.
 *
 * <p>{@link #saveFill(Order, PositionUpdate)} writes everything a single fill touches as one
 * unit: the order row, the trade, every changed lot and the resulting position. Implementations
 * either persist all of it or throw.
 */
public interface LedgerStore {

    void saveOrder(Order order);

    void saveFill(Order order, PositionUpdate update);

    Optional<Order> findOrder(String orderId);

    /** Newest first. A null symbol or mode matches everything. */
    List<Order> findOrderHistory(String symbol, TradingMode mode, int limit);

    /** Orders that are not yet terminal, for reload on startup. */
    List<Order> findActiveOrders();

    List<Trade> findTrades(String orderId);

    /** Trades of a mode executed in {@code [from, to)}, oldest first. */
    List<Trade> findTrades(TradingMode mode, LocalDateTime from, LocalDateTime to);

    /** Newest first. A null symbol or mode matches everything. */
    List<Trade> findTradeHistory(String symbol, TradingMode mode, int limit);

    /** All trades in execution order. Used to rebuild cash and daily P&L. */
    List<Trade> findAllTrades();

    List<Position> loadPositions();

    List<Lot> loadOpenLots();

    /** Every lot of a mode, closed lots included, in FIFO order. */
    List<Lot> loadLots(TradingMode mode);
}
