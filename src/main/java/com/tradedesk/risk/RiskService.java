package com.tradedesk.risk;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.Order;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.event.RiskEventType;
import com.tradedesk.event.RiskLevel;
import com.tradedesk.exception.PriceUnavailableException;
import com.tradedesk.exception.ValidationException;
import com.tradedesk.marketdata.MarketDataService;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Risk operations exposed to the API: previewing an order against the gate without placing
 * it, and replacing the active limits.
 */
@Service
public class RiskService {

    private final RiskGate riskGate;
    private final RiskLimitsHolder riskLimitsHolder;
    private final MarketDataService marketDataService;
    private final EventPublisherHelper eventPublisherHelper;

    public RiskService(
            RiskGate riskGate,
            RiskLimitsHolder riskLimitsHolder,
            MarketDataService marketDataService,
            EventPublisherHelper eventPublisherHelper) {
        this.riskGate = riskGate;
        this.riskLimitsHolder = riskLimitsHolder;
        this.marketDataService = marketDataService;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Runs the gate for a hypothetical order. The price is the given one, else the current
     * market price. A denial here is only reported to the caller: no risk event is published.
     */
    public RiskCheckResult preview(String symbol, OrderSide side, int quantity, BigDecimal price, TradingMode mode) {
        if (quantity <= 0) {
            throw new ValidationException("quantity", "Quantity must be positive");
        }
        String normalized = MarketDataService.normalize(symbol);
        BigDecimal referencePrice = price != null
                ? price
                : marketDataService.getCurrentPrice(normalized).orElseThrow(() -> new PriceUnavailableException(normalized));
        Order candidate = Order.builder()
                .id("risk-preview")
                .symbol(normalized)
                .side(side)
                .type(OrderType.MARKET)
                .quantity(quantity)
                .remainingQuantity(quantity)
                .mode(mode)
                .build();
        return riskGate.preview(candidate, referencePrice);
    }

    public RiskLimits getLimits() {
        return riskLimitsHolder.get();
    }

    public RiskLimits replaceLimits(RiskLimits limits) {
        RiskLimits previous = riskLimitsHolder.replace(limits);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.LIMITS_UPDATED,
                RiskLevel.INFO,
                "Risk limits updated",
                Map.of("previous", previous.toString(), "current", limits.toString()));
        return limits;
    }
}
