package com.tradedesk.marketdata;

import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * In-memory market data: the latest price per symbol plus a bounded close-price history.
 *
 * <p>Prices arrive through {@link #updatePrice} (REST or a feed adapter). Each update appends
 * to the history and publishes a PriceUpdateEvent, which the PositionBook uses to mark
 * positions to market. Symbols are case-insensitive and stored upper-case.
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final Map<String, BigDecimal> latestPrices = new ConcurrentHashMap<>();
    private final Map<String, Deque<BigDecimal>> closeHistory = new ConcurrentHashMap<>();

    private final EventPublisherHelper eventPublisherHelper;
    private final int maxHistory;

    public MarketDataService(
            EventPublisherHelper eventPublisherHelper,
            @Value("${tradedesk.market-data.max-history:500}") int maxHistory) {
        this.eventPublisherHelper = eventPublisherHelper;
        this.maxHistory = maxHistory;
    }

    /** Latest known price. Empty means the symbol cannot be executed right now. */
    public Optional<BigDecimal> getCurrentPrice(String symbol) {
        return Optional.ofNullable(latestPrices.get(normalize(symbol)));
    }

    /** Records a new price for the symbol and notifies listeners. */
    public void updatePrice(String symbol, BigDecimal price) {
        requirePositive(symbol, price);
        String key = normalize(symbol);
        latestPrices.put(key, price);
        Deque<BigDecimal> history = closeHistory.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(price);
            while (history.size() > maxHistory) {
                history.removeFirst();
            }
        }
        log.debug("Price update: symbol={} price={}", key, price);
        eventPublisherHelper.publishPriceUpdate(this, key, price, LocalDateTime.now());
    }

    /**
     * Replaces the close history of a symbol, oldest first. The last close becomes the
     * current price.
     */
    public void loadHistory(String symbol, List<BigDecimal> closes) {
        if (closes.isEmpty()) {
            throw new ValidationException("closes", "Close history must not be empty");
        }
        closes.forEach(close -> requirePositive(symbol, close));
        String key = normalize(symbol);
        List<BigDecimal> kept = closes.subList(Math.max(0, closes.size() - maxHistory), closes.size());
        closeHistory.put(key, new ArrayDeque<>(kept));
        BigDecimal last = closes.get(closes.size() - 1);
        latestPrices.put(key, last);
        log.info("Loaded {} closes for {}", kept.size(), key);
        eventPublisherHelper.publishPriceUpdate(this, key, last, LocalDateTime.now());
    }

    /** The most recent {@code lookback} closes, oldest first. */
    public List<BigDecimal> getCloseHistory(String symbol, int lookback) {
        Deque<BigDecimal> history = closeHistory.get(normalize(symbol));
        if (history == null) {
            return List.of();
        }
        List<BigDecimal> copy;
        synchronized (history) {
            copy = new ArrayList<>(history);
        }
        return List.copyOf(copy.subList(Math.max(0, copy.size() - lookback), copy.size()));
    }

    public Set<String> getSymbols() {
        return new TreeSet<>(latestPrices.keySet());
    }

    public static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static void requirePositive(String symbol, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new ValidationException("price", "Price for " + symbol + " must be positive");
        }
    }
}
