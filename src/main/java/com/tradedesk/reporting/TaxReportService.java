package com.tradedesk.reporting;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.Lot;
import com.tradedesk.domain.model.Trade;
import com.tradedesk.marketdata.MarketDataService;
import com.tradedesk.persistence.LedgerStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Builds the lot-based tax summary from persisted lots and trades.
 *
 * <p>Lots are attributed to the year they were acquired in. Closed lots stay in the store, so
 * a fully sold lot still contributes its realized gain and tax liability.
 */
@Service
public class TaxReportService {

    private static final Logger log = LoggerFactory.getLogger(TaxReportService.class);

    private final LedgerStore ledgerStore;
    private final BigDecimal highLiabilityThreshold;

    public TaxReportService(
            LedgerStore ledgerStore,
            @Value("${tradedesk.reports.high-tax-liability:1000000}") BigDecimal highLiabilityThreshold) {
        this.ledgerStore = ledgerStore;
        this.highLiabilityThreshold = highLiabilityThreshold;
    }

    /**
     * @param mode trading mode to report on
     * @param year calendar year, or null for all lots and the current year's trades
     */
    public TaxReport summary(TradingMode mode, Integer year) {
        List<Lot> lots = ledgerStore.loadLots(mode).stream()
                .filter(lot -> year == null || lot.getAcquiredAt().getYear() == year)
                .toList();

        int tradeYear = year != null ? year : LocalDateTime.now().getYear();
        LocalDateTime from = LocalDateTime.of(tradeYear, 1, 1, 0, 0);
        List<Trade> trades = ledgerStore.findTrades(mode, from, from.plusYears(1));

        Map<String, List<Lot>> bySymbol =
                lots.stream().collect(Collectors.groupingBy(Lot::getSymbol, TreeMap::new, Collectors.toList()));
        List<TaxSymbolSummary> symbols = bySymbol.entrySet().stream()
                .map(entry -> summarize(entry.getKey(), entry.getValue()))
                .toList();

        BigDecimal realizedGain = sum(lots, Lot::getRealizedGain);
        BigDecimal taxLiability = sum(lots, Lot::getTaxLiability);
        BigDecimal tradeRealized = sum(trades, Trade::getRealizedPnl);
        int soldQuantity = lots.stream().mapToInt(Lot::getSoldQuantity).sum();

        TaxReport report = TaxReport.builder()
                .mode(mode)
                .year(year)
                .lotCount(lots.size())
                .totalQuantity(lots.stream().mapToInt(Lot::getOriginalQuantity).sum())
                .soldQuantity(soldQuantity)
                .costBasis(sum(lots, Lot::getCostBasis))
                .realizedGain(realizedGain)
                .taxLiability(taxLiability)
                .tradeCount(trades.size())
                .buyCount((int) trades.stream().filter(t -> t.getSide() == OrderSide.BUY).count())
                .sellCount((int) trades.stream().filter(t -> t.getSide() == OrderSide.SELL).count())
                .turnover(sum(trades, Trade::getNotional))
                .totalCharges(sum(trades, t -> t.getCharges().getTotal()))
                .tradeRealizedPnl(tradeRealized)
                .symbols(symbols)
                .recommendations(recommendations(realizedGain, taxLiability, tradeRealized, soldQuantity))
                .build();

        log.info(
                "Tax report generated: mode={} year={} lots={} trades={} realizedGain={} taxLiability={}",
                mode,
                year,
                lots.size(),
                trades.size(),
                realizedGain,
                taxLiability);
        return report;
    }

    /**
     * Every lot of the mode in FIFO order, closed lots included. A null symbol lists all
     * symbols.
     */
    public List<Lot> listLots(TradingMode mode, String symbol) {
        String normalized = symbol != null ? MarketDataService.normalize(symbol) : null;
        return ledgerStore.loadLots(mode).stream()
                .filter(lot -> normalized == null || lot.getSymbol().equals(normalized))
                .toList();
    }

    private TaxSymbolSummary summarize(String symbol, List<Lot> lots) {
        return TaxSymbolSummary.builder()
                .symbol(symbol)
                .lotCount(lots.size())
                .totalQuantity(lots.stream().mapToInt(Lot::getOriginalQuantity).sum())
                .soldQuantity(lots.stream().mapToInt(Lot::getSoldQuantity).sum())
                .openQuantity(lots.stream().mapToInt(Lot::getRemainingQuantity).sum())
                .costBasis(sum(lots, Lot::getCostBasis))
                .realizedGain(sum(lots, Lot::getRealizedGain))
                .taxLiability(sum(lots, Lot::getTaxLiability))
                .build();
    }

    List<String> recommendations(
            BigDecimal realizedGain, BigDecimal taxLiability, BigDecimal tradeRealized, int soldQuantity) {
        List<String> recommendations = new ArrayList<>();
        if (realizedGain.signum() > 0) {
            recommendations.add("Consider tax-loss harvesting to offset realized gains");
        }
        if (taxLiability.compareTo(highLiabilityThreshold) > 0) {
            recommendations.add("High tax liability; consider consulting a tax advisor");
        }
        if (tradeRealized.signum() < 0) {
            recommendations.add("Realized losses can offset future gains");
        }
        if (soldQuantity > 0) {
            recommendations.add("Keep records of every lot sale for tax filing");
        }
        return recommendations;
    }

    private static <T> BigDecimal sum(List<T> items, Function<T, BigDecimal> field) {
        return items.stream()
                .map(field)
                .filter(value -> value != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }
}
