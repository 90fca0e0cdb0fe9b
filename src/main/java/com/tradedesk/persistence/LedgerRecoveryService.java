package com.tradedesk.persistence;

import com.tradedesk.domain.model.Lot;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.Position;
import com.tradedesk.domain.model.PositionKey;
import com.tradedesk.domain.model.Trade;
import com.tradedesk.ledger.PositionBook;
import com.tradedesk.oms.OrderLifecycleManager;
import com.tradedesk.portfolio.PortfolioService;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Rebuilds in-memory state from the ledger store once the application is ready.
 *
 * <ol>
 *   <li>Positions with their open lots go back into the {@link PositionBook}</li>
 *   <li>All trades are replayed into cash and daily realized P&L</li>
 *   <li>Non-terminal orders are handed back to the {@link OrderLifecycleManager}</li>
 * </ol>
 *
 * <p>A position whose lots no longer add up to its quantity stops startup.
 */
@Service
public class LedgerRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(LedgerRecoveryService.class);

    private final LedgerStore ledgerStore;
    private final PositionBook positionBook;
    private final PortfolioService portfolioService;
    private final OrderLifecycleManager orderLifecycleManager;

    public LedgerRecoveryService(
            LedgerStore ledgerStore,
            PositionBook positionBook,
            PortfolioService portfolioService,
            OrderLifecycleManager orderLifecycleManager) {
        this.ledgerStore = ledgerStore;
        this.positionBook = positionBook;
        this.portfolioService = portfolioService;
        this.orderLifecycleManager = orderLifecycleManager;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recover();
    }

    public void recover() {
        Map<PositionKey, List<Lot>> lotsByKey = ledgerStore.loadOpenLots().stream()
                .collect(Collectors.groupingBy(lot -> PositionKey.of(lot.getSymbol(), lot.getMode())));

        List<Position> positions = ledgerStore.loadPositions();
        for (Position position : positions) {
            positionBook.restore(position, lotsByKey.getOrDefault(position.getKey(), List.of()));
        }

        List<Trade> trades = ledgerStore.findAllTrades();
        portfolioService.replay(trades);

        List<Order> activeOrders = ledgerStore.findActiveOrders();
        orderLifecycleManager.restoreOrders(activeOrders);

        log.info(
                "Ledger recovered: positions={} openLots={} trades={} activeOrders={}",
                positions.size(),
                lotsByKey.values().stream().mapToInt(List::size).sum(),
                trades.size(),
                activeOrders.size());
    }
}
