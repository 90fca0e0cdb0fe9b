package com.tradedesk.persistence;

import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.Lot;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.Position;
import com.tradedesk.domain.model.PositionUpdate;
import com.tradedesk.domain.model.Trade;
import com.tradedesk.mapper.LotMapper;
import com.tradedesk.mapper.OrderMapper;
import com.tradedesk.mapper.PositionMapper;
import com.tradedesk.mapper.TradeMapper;
import com.tradedesk.repository.jpa.LotJpaRepository;
import com.tradedesk.repository.jpa.OrderJpaRepository;
import com.tradedesk.repository.jpa.PositionJpaRepository;
import com.tradedesk.repository.jpa.TradeJpaRepository;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * H2/JPA implementation of {@link LedgerStore}.
 *
 * <p>Each write method is its own transaction. A fill writes the order, the trade, all
 * changed lots (closed ones included, for tax reporting) and the position row; a failure
 * anywhere rolls back the whole fill.
 */
@Service
public class JpaLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JpaLedgerStore.class);

    private static final List<OrderStatus> ACTIVE_STATUSES = Arrays.stream(OrderStatus.values())
            .filter(status -> !status.isTerminal())
            .toList();

    private final OrderJpaRepository orderJpaRepository;
    private final TradeJpaRepository tradeJpaRepository;
    private final LotJpaRepository lotJpaRepository;
    private final PositionJpaRepository positionJpaRepository;
    private final OrderMapper orderMapper;
    private final TradeMapper tradeMapper;
    private final LotMapper lotMapper;
    private final PositionMapper positionMapper;

    public JpaLedgerStore(
            OrderJpaRepository orderJpaRepository,
            TradeJpaRepository tradeJpaRepository,
            LotJpaRepository lotJpaRepository,
            PositionJpaRepository positionJpaRepository,
            OrderMapper orderMapper,
            TradeMapper tradeMapper,
            LotMapper lotMapper,
            PositionMapper positionMapper) {
        this.orderJpaRepository = orderJpaRepository;
        this.tradeJpaRepository = tradeJpaRepository;
        this.lotJpaRepository = lotJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
        this.orderMapper = orderMapper;
        this.tradeMapper = tradeMapper;
        this.lotMapper = lotMapper;
        this.positionMapper = positionMapper;
    }

    @Override
    @Transactional
    public void saveOrder(Order order) {
        orderJpaRepository.save(orderMapper.toEntity(order));
        log.debug("Order persisted: id={} status={}", order.getId(), order.getStatus());
    }

    @Override
    @Transactional
    public void saveFill(Order order, PositionUpdate update) {
        orderJpaRepository.save(orderMapper.toEntity(order));
        tradeJpaRepository.save(tradeMapper.toEntity(update.getTrade()));
        for (Lot lot : update.getChangedLots()) {
            lotJpaRepository.save(lotMapper.toEntity(lot));
        }
        positionJpaRepository.save(positionMapper.toEntity(update.getPosition()));
        log.debug(
                "Fill persisted: orderId={} tradeId={} lots={}",
                order.getId(),
                update.getTrade().getId(),
                update.getChangedLots().size());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findOrder(String orderId) {
        return orderJpaRepository.findById(orderId).map(orderMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findOrderHistory(String symbol, TradingMode mode, int limit) {
        return orderMapper.toDomainList(orderJpaRepository.findHistory(symbol, mode, PageRequest.of(0, limit)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findActiveOrders() {
        return orderMapper.toDomainList(orderJpaRepository.findByStatusIn(ACTIVE_STATUSES));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trade> findTrades(String orderId) {
        return tradeMapper.toDomainList(tradeJpaRepository.findByOrderIdOrderByExecutedAtAsc(orderId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trade> findTrades(TradingMode mode, LocalDateTime from, LocalDateTime to) {
        return tradeMapper.toDomainList(tradeJpaRepository.findByModeAndDateRange(mode, from, to));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trade> findTradeHistory(String symbol, TradingMode mode, int limit) {
        return tradeMapper.toDomainList(tradeJpaRepository.findHistory(symbol, mode, PageRequest.of(0, limit)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trade> findAllTrades() {
        return tradeMapper.toDomainList(tradeJpaRepository.findAll(Sort.by("executedAt")));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> loadPositions() {
        return positionMapper.toDomainList(positionJpaRepository.findAll());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Lot> loadOpenLots() {
        return lotMapper.toDomainList(lotJpaRepository.findByRemainingQuantityGreaterThan(0));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Lot> loadLots(TradingMode mode) {
        return lotMapper.toDomainList(lotJpaRepository.findByModeOrderByAcquiredAtAscSequenceAsc(mode));
    }
}
