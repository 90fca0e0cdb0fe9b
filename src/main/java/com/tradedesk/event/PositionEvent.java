package com.tradedesk.event;

import com.tradedesk.domain.model.PositionSnapshot;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the PositionBook after a trade has been applied and committed.
 */
public class PositionEvent extends ApplicationEvent {

    private final PositionSnapshot position;
    private final PositionEventType eventType;
    private final BigDecimal realizedPnl;

    /**
     * @param source      the component publishing this event
     * @param position    the position after the trade
     * @param eventType   what kind of change the trade caused
     * @param realizedPnl P&L realized by the trade (zero when it only added exposure)
     */
    public PositionEvent(
            Object source, PositionSnapshot position, PositionEventType eventType, BigDecimal realizedPnl) {
        super(source);
        this.position = position;
        this.eventType = eventType;
        this.realizedPnl = realizedPnl;
    }

    public PositionSnapshot getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }

    public BigDecimal getRealizedPnl() {
        return realizedPnl;
    }
}
