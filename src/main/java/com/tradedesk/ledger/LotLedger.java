package com.tradedesk.ledger;

import com.tradedesk.domain.enums.PositionDirection;
import com.tradedesk.domain.model.Lot;
import com.tradedesk.domain.model.LotConsumption;
import com.tradedesk.domain.model.PositionKey;
import com.tradedesk.exception.InsufficientLotsException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * FIFO cost-basis lots of one position.
 *
 * <p>Long and short lots are kept in separate queues and never netted against each other:
 * a buy on a long position adds a long lot, a sell closing it consumes long lots, and the
 * symmetric rules apply to shorts. Queues are ordered by acquisition time, then by insertion
 * sequence, so lots acquired at the same instant are consumed in the order they were added.
 *
 * <p>Fully consumed lots leave the queue; callers get their final state from
 * {@link LotConsumption#getLots()} for persistence.
 *
 * <p>Not thread-safe. The owning PositionBook serializes access per position and works on
 * a {@link #copy()} so a failed commit leaves the installed ledger untouched.
 */
public class LotLedger {

    static final Comparator<Lot> FIFO =
            Comparator.comparing(Lot::getAcquiredAt).thenComparingLong(Lot::getSequence);

    private final PositionKey key;
    private final BigDecimal taxRate;
    private final List<Lot> longLots;
    private final List<Lot> shortLots;
    private long nextSequence;

    public LotLedger(PositionKey key, BigDecimal taxRate) {
        this(key, taxRate, new ArrayList<>(), new ArrayList<>(), 0L);
    }

    private LotLedger(
            PositionKey key, BigDecimal taxRate, List<Lot> longLots, List<Lot> shortLots, long nextSequence) {
        this.key = key;
        this.taxRate = taxRate;
        this.longLots = longLots;
        this.shortLots = shortLots;
        this.nextSequence = nextSequence;
    }

    /**
     * Rebuilds a ledger from persisted lots. Closed lots are ignored; the sequence counter
     * continues after the highest restored sequence.
     */
    public static LotLedger restore(PositionKey key, BigDecimal taxRate, List<Lot> lots) {
        LotLedger ledger = new LotLedger(key, taxRate);
        for (Lot lot : lots) {
            if (!lot.isOpen()) {
                continue;
            }
            ledger.queue(lot.getDirection()).add(lot.copy());
            ledger.nextSequence = Math.max(ledger.nextSequence, lot.getSequence() + 1);
        }
        ledger.longLots.sort(FIFO);
        ledger.shortLots.sort(FIFO);
        return ledger;
    }

    /**
     * Appends a lot that increases exposure in {@code direction}.
     *
     * @return a copy of the new lot
     */
    public Lot addLot(PositionDirection direction, int quantity, BigDecimal unitCost, LocalDateTime acquiredAt) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Lot quantity must be positive: " + quantity);
        }
        Lot lot = Lot.builder()
                .id(UUID.randomUUID().toString())
                .symbol(key.getSymbol())
                .mode(key.getMode())
                .direction(direction)
                .originalQuantity(quantity)
                .remainingQuantity(quantity)
                .unitCost(unitCost)
                .acquiredAt(acquiredAt)
                .sequence(nextSequence++)
                .soldQuantity(0)
                .build();

        List<Lot> queue = queue(direction);
        queue.add(lot);
        queue.sort(FIFO);
        return lot.copy();
    }

    /**
     * Consumes {@code quantity} units of {@code direction} lots, oldest first, at
     * {@code fillPrice}.
     *
     * <p>Realized P&L per slice is {@code (fillPrice - unitCost) * consumed} for long lots and
     * the negation for short lots. Tax liability per slice is
     * {@code fillPrice * consumed * taxRate}.
     *
     * @throws InsufficientLotsException if the open lots hold less than {@code quantity};
     *     nothing is consumed in that case
     */
    public LotConsumption consume(PositionDirection direction, int quantity, BigDecimal fillPrice) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Consumed quantity must be positive: " + quantity);
        }
        int available = openQuantity(direction);
        if (quantity > available) {
            throw new InsufficientLotsException(key.getSymbol(), quantity, available);
        }

        BigDecimal realizedPnl = BigDecimal.ZERO;
        BigDecimal taxLiability = BigDecimal.ZERO;
        List<LotConsumption.Slice> slices = new ArrayList<>();
        List<Lot> touched = new ArrayList<>();

        List<Lot> queue = queue(direction);
        int left = quantity;
        for (Lot lot : queue) {
            if (left == 0) {
                break;
            }
            int take = Math.min(lot.getRemainingQuantity(), left);
            BigDecimal units = BigDecimal.valueOf(take);

            BigDecimal pnl = fillPrice.subtract(lot.getUnitCost()).multiply(units);
            if (direction == PositionDirection.SHORT) {
                pnl = pnl.negate();
            }
            BigDecimal tax = fillPrice.multiply(units).multiply(taxRate).setScale(2, RoundingMode.HALF_UP);

            lot.setRemainingQuantity(lot.getRemainingQuantity() - take);
            lot.setSoldQuantity(lot.getSoldQuantity() + take);
            lot.setRealizedGain(lot.getRealizedGain().add(pnl));
            lot.setTaxLiability(lot.getTaxLiability().add(tax));

            realizedPnl = realizedPnl.add(pnl);
            taxLiability = taxLiability.add(tax);
            slices.add(new LotConsumption.Slice(lot.getId(), take, lot.getUnitCost(), pnl));
            touched.add(lot.copy());
            left -= take;
        }

        queue.removeIf(lot -> !lot.isOpen());

        return LotConsumption.builder()
                .quantity(quantity)
                .realizedPnl(realizedPnl)
                .taxLiability(taxLiability)
                .slices(List.copyOf(slices))
                .lots(List.copyOf(touched))
                .build();
    }

    public int openQuantity(PositionDirection direction) {
        return queue(direction).stream().mapToInt(Lot::getRemainingQuantity).sum();
    }

    /** Long remaining minus short remaining. Must equal the position's signed quantity. */
    public int signedOpenQuantity() {
        return openQuantity(PositionDirection.LONG) - openQuantity(PositionDirection.SHORT);
    }

    /** Copies of the open lots of one direction, in consumption order. */
    public List<Lot> openLots(PositionDirection direction) {
        return queue(direction).stream().map(Lot::copy).toList();
    }

    /** Copies of all open lots, long lots first. */
    public List<Lot> openLots() {
        List<Lot> all = new ArrayList<>(openLots(PositionDirection.LONG));
        all.addAll(openLots(PositionDirection.SHORT));
        return all;
    }

    /** Deep copy: mutating the copy never affects this ledger. */
    public LotLedger copy() {
        return new LotLedger(
                key,
                taxRate,
                new ArrayList<>(longLots.stream().map(Lot::copy).toList()),
                new ArrayList<>(shortLots.stream().map(Lot::copy).toList()),
                nextSequence);
    }

    private List<Lot> queue(PositionDirection direction) {
        return direction == PositionDirection.LONG ? longLots : shortLots;
    }
}
