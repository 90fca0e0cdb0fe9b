package com.tradedesk.event;

import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.Trade;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the OrderLifecycleManager after an order state change has been committed.
 *
 * <p>Fill events carry the Trade created by the fill; other events carry a null trade.
 * Listeners: TradingMetrics (counters per event type).
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;
    private final Trade trade;

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus, Trade trade) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
        this.trade = trade;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        this(source, order, eventType, previousStatus, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }

    /** The fill behind a PARTIALLY_FILLED or FILLED event. Null for other types. */
    public Trade getTrade() {
        return trade;
    }
}
