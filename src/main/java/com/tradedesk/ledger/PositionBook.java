package com.tradedesk.ledger;

import com.tradedesk.domain.enums.PositionDirection;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.Lot;
import com.tradedesk.domain.model.LotConsumption;
import com.tradedesk.domain.model.Position;
import com.tradedesk.domain.model.PositionKey;
import com.tradedesk.domain.model.PositionSnapshot;
import com.tradedesk.domain.model.PositionUpdate;
import com.tradedesk.domain.model.Trade;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.event.PositionEventType;
import com.tradedesk.event.PriceUpdateEvent;
import com.tradedesk.pnl.ChargeCalculator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Aggregate positions per (symbol, trading mode), each owning a {@link LotLedger}.
 *
 * <p>Trade application:
 * <ul>
 *   <li>Same direction (or flat): add a lot, average price becomes the quantity-weighted mean
 *       of the old cost basis and the fill</li>
 *   <li>Opposite direction: consume lots FIFO up to the open quantity; any excess opens the
 *       opposite direction as a new lot with the average reset to the fill price</li>
 * </ul>
 * After every apply the signed quantity equals the signed sum of remaining lot quantities.
 *
 * <p>Locking: every mutation of a key holds that key's lock plus the read side of a
 * book-wide read/write lock. {@link #withConsistentView(Supplier)} takes the write side, so
 * a caller inside it sees no half-applied trade on any key. Mutations work on copies of the
 * position and ledger, and the copies are installed only after the commit callback returns.
 */
@Service
public class PositionBook {

    private static final Logger log = LoggerFactory.getLogger(PositionBook.class);

    static final int PRICE_SCALE = 4;

    private final Map<PositionKey, PositionState> positions = new ConcurrentHashMap<>();
    private final Map<PositionKey, ReentrantLock> keyLocks = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock viewLock = new ReentrantReadWriteLock();

    private final BigDecimal taxRate;
    private final EventPublisherHelper eventPublisherHelper;

    public PositionBook(ChargeCalculator chargeCalculator, EventPublisherHelper eventPublisherHelper) {
        this.taxRate = chargeCalculator.getTaxRate();
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /** Applies a trade with no commit side effects. */
    public PositionUpdate apply(Trade trade) {
        return apply(trade, update -> {});
    }

    /**
     * Applies a trade to its position.
     *
     * <p>{@code committer} runs while the key is still locked, after the new state has been
     * computed but before it is installed. If it throws, the installed position and lots are
     * left exactly as they were and the exception propagates.
     *
     * @return the resulting position, changed lots and realized P&L
     * @throws com.tradedesk.exception.InsufficientLotsException if the lots cannot cover a close
     */
    public PositionUpdate apply(Trade trade, Consumer<PositionUpdate> committer) {
        PositionKey key = trade.getPositionKey();
        PositionUpdate update;

        ReentrantLock keyLock = lockFor(key);
        viewLock.readLock().lock();
        keyLock.lock();
        try {
            PositionState current = positions.get(key);
            Position previous = current != null ? current.position : Position.flat(key);
            LotLedger ledger = current != null ? current.ledger.copy() : new LotLedger(key, taxRate);

            update = computeUpdate(trade, previous, ledger);
            committer.accept(update);

            positions.put(key, new PositionState(update.getPosition().copy(), ledger));
        } finally {
            keyLock.unlock();
            viewLock.readLock().unlock();
        }

        log.info(
                "Position updated: key={} qty={} avg={} realized={} tradeRealized={}",
                key,
                update.getPosition().getQuantity(),
                update.getPosition().getAveragePrice(),
                update.getPosition().getRealizedPnl(),
                update.getRealizedPnl());

        eventPublisherHelper.publishPositionChanged(
                this,
                getPosition(key.getSymbol(), key.getMode()),
                eventTypeOf(update),
                update.getRealizedPnl());
        return update;
    }

    private PositionUpdate computeUpdate(Trade trade, Position previous, LotLedger ledger) {
        Position next = previous.copy();
        int previousQuantity = previous.getQuantity();
        int tradeQuantity = trade.getQuantity();
        BigDecimal fillPrice = trade.getFillPrice();
        LocalDateTime at = trade.getExecutedAt();
        PositionDirection tradeDirection = PositionDirection.of(trade.getSide());

        List<Lot> changedLots = new ArrayList<>();
        LotConsumption consumption = LotConsumption.none();
        int closedQuantity = 0;
        int openedQuantity = 0;

        if (previousQuantity == 0 || previous.getDirection() == tradeDirection) {
            changedLots.add(ledger.addLot(tradeDirection, tradeQuantity, fillPrice, at));
            openedQuantity = tradeQuantity;

            if (previousQuantity == 0) {
                next.setAveragePrice(fillPrice);
                next.setOpenedAt(at);
                next.setClosedAt(null);
            } else {
                BigDecimal existingCost =
                        previous.getAveragePrice().multiply(BigDecimal.valueOf(Math.abs(previousQuantity)));
                BigDecimal addedCost = fillPrice.multiply(BigDecimal.valueOf(tradeQuantity));
                BigDecimal units = BigDecimal.valueOf(Math.abs(previousQuantity) + tradeQuantity);
                next.setAveragePrice(existingCost.add(addedCost).divide(units, PRICE_SCALE, RoundingMode.HALF_UP));
            }
        } else {
            // Close against existing exposure first, then open the remainder the other way
            closedQuantity = Math.min(Math.abs(previousQuantity), tradeQuantity);
            consumption = ledger.consume(previous.getDirection(), closedQuantity, fillPrice);
            changedLots.addAll(consumption.getLots());

            int excess = tradeQuantity - closedQuantity;
            if (excess > 0) {
                changedLots.add(ledger.addLot(tradeDirection, excess, fillPrice, at));
                openedQuantity = excess;
                next.setAveragePrice(fillPrice);
                next.setOpenedAt(at);
                next.setClosedAt(null);
            } else if (closedQuantity == Math.abs(previousQuantity)) {
                next.setAveragePrice(BigDecimal.ZERO);
                next.setClosedAt(at);
            }
        }

        next.setQuantity(previousQuantity + trade.getSide().sign() * tradeQuantity);
        next.setRealizedPnl(next.getRealizedPnl().add(consumption.getRealizedPnl()));
        next.setTaxLiability(next.getTaxLiability().add(consumption.getTaxLiability()));
        next.setMarketPrice(fillPrice);
        next.setUpdatedAt(at);
        revalue(next);

        if (next.getQuantity() != ledger.signedOpenQuantity()) {
            throw new IllegalStateException(String.format(
                    "Lot ledger out of sync for %s: position qty=%d, lots=%d",
                    next.getKey(), next.getQuantity(), ledger.signedOpenQuantity()));
        }

        return PositionUpdate.builder()
                .trade(trade.toBuilder().realizedPnl(consumption.getRealizedPnl()).build())
                .previous(previous)
                .position(next)
                .changedLots(List.copyOf(changedLots))
                .closedQuantity(closedQuantity)
                .openedQuantity(openedQuantity)
                .realizedPnl(consumption.getRealizedPnl())
                .taxLiability(consumption.getTaxLiability())
                .build();
    }

    /**
     * Recomputes unrealized and total P&L at {@code marketPrice}. Lots are not touched.
     *
     * @return the revalued position, or empty if no position exists for the key
     */
    public Optional<PositionSnapshot> markToMarket(PositionKey key, BigDecimal marketPrice) {
        ReentrantLock keyLock = lockFor(key);
        viewLock.readLock().lock();
        keyLock.lock();
        try {
            PositionState current = positions.get(key);
            if (current == null) {
                return Optional.empty();
            }
            Position marked = current.position.copy();
            marked.setMarketPrice(marketPrice);
            revalue(marked);
            positions.put(key, new PositionState(marked, current.ledger));
            return Optional.of(PositionSnapshot.of(marked, current.ledger.openLots()));
        } finally {
            keyLock.unlock();
            viewLock.readLock().unlock();
        }
    }

    /** Marks the symbol's positions in every trading mode. */
    public void markSymbol(String symbol, BigDecimal marketPrice) {
        for (TradingMode mode : TradingMode.values()) {
            markToMarket(PositionKey.of(symbol, mode), marketPrice);
        }
    }

    @EventListener
    public void onPriceUpdate(PriceUpdateEvent event) {
        markSymbol(event.getSymbol(), event.getPrice());
    }

    /**
     * Runs {@code reader} while no position is being mutated. Readers inside see one
     * consistent state of every key.
     */
    public <T> T withConsistentView(Supplier<T> reader) {
        viewLock.writeLock().lock();
        try {
            return reader.get();
        } finally {
            viewLock.writeLock().unlock();
        }
    }

    /** Snapshot of one position. A never-traded key yields a flat snapshot with no lots. */
    public PositionSnapshot getPosition(String symbol, TradingMode mode) {
        PositionKey key = PositionKey.of(symbol, mode);
        PositionState state = positions.get(key);
        if (state == null) {
            return PositionSnapshot.of(Position.flat(key), List.of());
        }
        return PositionSnapshot.of(state.position, state.ledger.openLots());
    }

    /** Non-flat positions of a mode, ordered by symbol. */
    public List<PositionSnapshot> getPositions(TradingMode mode) {
        return positions.values().stream()
                .filter(state -> state.position.getMode() == mode && !state.position.isFlat())
                .map(state -> PositionSnapshot.of(state.position, state.ledger.openLots()))
                .sorted(Comparator.comparing(PositionSnapshot::getSymbol))
                .toList();
    }

    /** Every position ever opened, including flat ones, across both modes. */
    public List<PositionSnapshot> snapshot() {
        return positions.values().stream()
                .map(state -> PositionSnapshot.of(state.position, state.ledger.openLots()))
                .sorted(Comparator.comparing(PositionSnapshot::getSymbol)
                        .thenComparing(PositionSnapshot::getMode))
                .toList();
    }

    /** Installs a persisted position and its lots. Used on startup recovery. */
    public void restore(Position position, List<Lot> lots) {
        PositionKey key = position.getKey();
        LotLedger ledger = LotLedger.restore(key, taxRate, lots);
        if (position.getQuantity() != ledger.signedOpenQuantity()) {
            throw new IllegalStateException(String.format(
                    "Persisted lots for %s do not match position qty=%d, lots=%d",
                    key, position.getQuantity(), ledger.signedOpenQuantity()));
        }
        ReentrantLock keyLock = lockFor(key);
        keyLock.lock();
        try {
            positions.put(key, new PositionState(position.copy(), ledger));
        } finally {
            keyLock.unlock();
        }
    }

    private void revalue(Position position) {
        BigDecimal unrealized = BigDecimal.ZERO;
        if (position.getQuantity() != 0 && position.getMarketPrice() != null) {
            unrealized = position.getMarketPrice()
                    .subtract(position.getAveragePrice())
                    .multiply(BigDecimal.valueOf(position.getQuantity()))
                    .setScale(2, RoundingMode.HALF_UP);
        }
        position.setUnrealizedPnl(unrealized);
        position.setTotalPnl(position.getRealizedPnl().add(unrealized));
    }

    private PositionEventType eventTypeOf(PositionUpdate update) {
        if (update.isFlipped()) {
            return PositionEventType.FLIPPED;
        }
        if (update.getPosition().isFlat()) {
            return PositionEventType.CLOSED;
        }
        if (update.getClosedQuantity() > 0) {
            return PositionEventType.REDUCED;
        }
        return update.getPrevious().isFlat() ? PositionEventType.OPENED : PositionEventType.INCREASED;
    }

    private ReentrantLock lockFor(PositionKey key) {
        return keyLocks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    private static final class PositionState {
        private final Position position;
        private final LotLedger ledger;

        private PositionState(Position position, LotLedger ledger) {
            this.position = position;
            this.ledger = ledger;
        }
    }
}
