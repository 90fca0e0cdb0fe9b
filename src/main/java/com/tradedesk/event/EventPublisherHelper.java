package com.tradedesk.event;

import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.PositionSnapshot;
import com.tradedesk.domain.model.Trade;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed wrapper around Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Call sites read as {@code eventPublisherHelper.publishOrderFilled(this, order, prev, trade)}
 * instead of constructing event objects inline. Delivery is synchronous unless a listener
 * is annotated {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderSubmitted(Object source, Order order) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.SUBMITTED, OrderStatus.PENDING));
    }

    public void publishOrderFilled(Object source, Order order, OrderStatus previousStatus, Trade trade) {
        OrderEventType type =
                order.getStatus() == OrderStatus.FILLED ? OrderEventType.FILLED : OrderEventType.PARTIALLY_FILLED;
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, type, previousStatus, trade));
    }

    public void publishOrderCancelled(Object source, Order order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.CANCELLED, previousStatus));
    }

    public void publishOrderExpired(Object source, Order order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.EXPIRED, previousStatus));
    }

    public void publishOrderRejected(Object source, Order order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.REJECTED, previousStatus));
    }

    // ---- Position ----

    public void publishPositionChanged(
            Object source, PositionSnapshot position, PositionEventType eventType, BigDecimal realizedPnl) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, eventType, realizedPnl));
    }

    // ---- Risk ----

    public void publishRiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message, details));
    }

    // ---- Market data ----

    public void publishPriceUpdate(Object source, String symbol, BigDecimal price, LocalDateTime observedAt) {
        applicationEventPublisher.publishEvent(new PriceUpdateEvent(source, symbol, price, observedAt));
    }
}
