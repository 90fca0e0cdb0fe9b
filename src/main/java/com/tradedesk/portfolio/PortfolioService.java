package com.tradedesk.portfolio;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.PositionSnapshot;
import com.tradedesk.domain.model.PositionUpdate;
import com.tradedesk.domain.model.Trade;
import com.tradedesk.ledger.PositionBook;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Cash and daily realized P&L per trading mode, and the portfolio figures derived from them.
 *
 * <p>Each mode starts with {@code tradedesk.trading.initial-capital}. A buy debits turnover
 * plus charges, a sell credits turnover less charges (short sales included). Portfolio value
 * is cash plus the signed market value of open positions.
 *
 * <p>{@link #applyFill(PositionUpdate)} is called from the PositionBook commit callback, under
 * the position lock, so RiskGate reads inside {@code withConsistentView} never see cash and
 * positions out of step.
 */
@Service
public class PortfolioService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioService.class);

    private final PositionBook positionBook;
    private final BigDecimal initialCapital;

    private final Map<TradingMode, BigDecimal> cash = new ConcurrentHashMap<>();
    private final Map<TradingMode, BigDecimal> charges = new ConcurrentHashMap<>();
    private final Map<TradingMode, Map<LocalDate, BigDecimal>> dailyRealized = new EnumMap<>(TradingMode.class);

    public PortfolioService(
            PositionBook positionBook,
            @Value("${tradedesk.trading.initial-capital:100000}") BigDecimal initialCapital) {
        this.positionBook = positionBook;
        this.initialCapital = initialCapital;
        for (TradingMode mode : TradingMode.values()) {
            cash.put(mode, initialCapital);
            charges.put(mode, BigDecimal.ZERO);
            dailyRealized.put(mode, new ConcurrentHashMap<>());
        }
    }

    /** Books the cash flow, charges and realized P&L of a committed fill. */
    public void applyFill(PositionUpdate update) {
        Trade trade = update.getTrade();
        TradingMode mode = trade.getMode();
        BigDecimal fees = trade.getCharges().getTotal();
        BigDecimal flow = trade.getSide() == OrderSide.BUY
                ? trade.getNotional().add(fees).negate()
                : trade.getNotional().subtract(fees);

        cash.merge(mode, flow, BigDecimal::add);
        charges.merge(mode, fees, BigDecimal::add);
        if (update.getRealizedPnl().signum() != 0) {
            dailyRealized.get(mode).merge(trade.getExecutedAt().toLocalDate(), update.getRealizedPnl(), BigDecimal::add);
        }

        log.debug(
                "Cash updated: mode={} flow={} cash={} realized={}",
                mode,
                flow,
                cash.get(mode),
                update.getRealizedPnl());
    }

    /** Replays persisted trades into cash and daily P&L. Used on startup recovery. */
    public void replay(List<Trade> trades) {
        for (Trade trade : trades) {
            BigDecimal realized = trade.getRealizedPnl() != null ? trade.getRealizedPnl() : BigDecimal.ZERO;
            applyFill(PositionUpdate.builder().trade(trade).realizedPnl(realized).build());
        }
    }

    public BigDecimal cash(TradingMode mode) {
        return cash.get(mode);
    }

    /** Cash plus signed market value of open positions. */
    public BigDecimal portfolioValue(TradingMode mode) {
        BigDecimal signedExposure = holdings(mode).stream()
                .map(p -> p.getMarketValue().multiply(BigDecimal.valueOf(Integer.signum(p.getQuantity()))))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return cash(mode).add(signedExposure).setScale(2, RoundingMode.HALF_UP);
    }

    /** Open positions of the mode. */
    public List<PositionSnapshot> holdings(TradingMode mode) {
        return positionBook.getPositions(mode);
    }

    public BigDecimal dailyRealizedPnl(TradingMode mode, LocalDate date) {
        return dailyRealized.get(mode).getOrDefault(date, BigDecimal.ZERO);
    }

    public BigDecimal todayRealizedPnl(TradingMode mode) {
        return dailyRealizedPnl(mode, LocalDate.now());
    }

    public BigDecimal unrealizedPnl(TradingMode mode) {
        return holdings(mode).stream()
                .map(PositionSnapshot::getUnrealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public PortfolioSummary summary(TradingMode mode) {
        List<PositionSnapshot> open = holdings(mode);
        BigDecimal realized = positionBook.snapshot().stream()
                .filter(p -> p.getMode() == mode)
                .map(PositionSnapshot::getRealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal unrealized = unrealizedPnl(mode);
        BigDecimal invested =
                open.stream().map(PositionSnapshot::getMarketValue).reduce(BigDecimal.ZERO, BigDecimal::add);

        return PortfolioSummary.builder()
                .mode(mode)
                .initialCapital(initialCapital)
                .cash(cash(mode).setScale(2, RoundingMode.HALF_UP))
                .investedValue(invested.setScale(2, RoundingMode.HALF_UP))
                .portfolioValue(portfolioValue(mode))
                .realizedPnl(realized)
                .unrealizedPnl(unrealized)
                .totalPnl(realized.add(unrealized))
                .dailyRealizedPnl(todayRealizedPnl(mode))
                .totalCharges(charges.get(mode))
                .openPositions(open.size())
                .positions(open)
                .build();
    }
}
