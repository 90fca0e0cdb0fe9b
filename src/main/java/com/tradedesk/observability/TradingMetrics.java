package com.tradedesk.observability;

import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.event.OrderEvent;
import com.tradedesk.event.OrderEventType;
import com.tradedesk.event.PositionEvent;
import com.tradedesk.event.RiskEvent;
import com.tradedesk.event.RiskEventType;
import com.tradedesk.portfolio.PortfolioService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.math.BigDecimal;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the order flow.
 *
 * <ul>
 *   <li><b>orders.submitted</b>, <b>orders.filled</b>, <b>orders.rejected</b>,
 *       <b>orders.cancelled</b> (counters) from OrderEvents</li>
 *   <li><b>trades.executed</b> (counter): one per fill, partial fills included</li>
 *   <li><b>risk.rejections</b> (counter) from RiskEvents</li>
 *   <li><b>positions.realized.pnl</b> (counter of realized gains, losses excluded)</li>
 *   <li><b>portfolio.cash</b> (gauge) per trading mode, tagged {@code mode}</li>
 * </ul>
 */
@Service
public class TradingMetrics {

    private final Counter ordersSubmitted;
    private final Counter ordersFilled;
    private final Counter ordersRejected;
    private final Counter ordersCancelled;
    private final Counter tradesExecuted;
    private final Counter riskRejections;
    private final Counter realizedGains;

    public TradingMetrics(MeterRegistry meterRegistry, PortfolioService portfolioService) {
        this.ordersSubmitted = Counter.builder("orders.submitted")
                .description("Orders accepted and submitted")
                .register(meterRegistry);
        this.ordersFilled = Counter.builder("orders.filled")
                .description("Orders completely filled")
                .register(meterRegistry);
        this.ordersRejected = Counter.builder("orders.rejected")
                .description("Orders rejected by risk checks")
                .register(meterRegistry);
        this.ordersCancelled = Counter.builder("orders.cancelled")
                .description("Orders cancelled or expired")
                .register(meterRegistry);
        this.tradesExecuted = Counter.builder("trades.executed")
                .description("Fills booked, partial fills included")
                .register(meterRegistry);
        this.riskRejections = Counter.builder("risk.rejections")
                .description("Risk gate denials")
                .register(meterRegistry);
        this.realizedGains = Counter.builder("positions.realized.pnl")
                .description("Positive realized P&L booked by position reductions")
                .register(meterRegistry);

        for (TradingMode mode : TradingMode.values()) {
            meterRegistry.gauge(
                    "portfolio.cash",
                    Tags.of("mode", mode.name()),
                    portfolioService,
                    service -> service.cash(mode).doubleValue());
        }
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        OrderEventType type = event.getEventType();
        switch (type) {
            case SUBMITTED -> ordersSubmitted.increment();
            case FILLED -> {
                ordersFilled.increment();
                tradesExecuted.increment();
            }
            case PARTIALLY_FILLED -> tradesExecuted.increment();
            case REJECTED -> ordersRejected.increment();
            case CANCELLED, EXPIRED -> ordersCancelled.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.ORDER_REJECTED) {
            riskRejections.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        BigDecimal realized = event.getRealizedPnl();
        if (realized != null && realized.signum() > 0) {
            realizedGains.increment(realized.doubleValue());
        }
    }
}
