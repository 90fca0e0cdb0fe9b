package com.tradedesk.oms;

import com.tradedesk.domain.model.Order;
import com.tradedesk.exception.BaseException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Periodically retries execution of resting orders (SUBMITTED and PARTIALLY_FILLED).
 *
 * <p>LIMIT and stop orders wait here until the market price crosses their conditions.
 * Started and stopped with the application context via {@link SmartLifecycle}; a failure on
 * one order is logged and the scan moves on to the next.
 */
@Component
public class PendingOrderScanner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PendingOrderScanner.class);

    private final OrderLifecycleManager orderLifecycleManager;
    private final TaskScheduler taskScheduler;
    private final long intervalMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledScan;

    public PendingOrderScanner(
            OrderLifecycleManager orderLifecycleManager,
            TaskScheduler taskScheduler,
            @Value("${tradedesk.scanner.interval-ms:1000}") long intervalMs) {
        this.orderLifecycleManager = orderLifecycleManager;
        this.taskScheduler = taskScheduler;
        this.intervalMs = intervalMs;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduledScan = taskScheduler.scheduleWithFixedDelay(this::scan, Duration.ofMillis(intervalMs));
            log.info("PendingOrderScanner started: intervalMs={}", intervalMs);
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (scheduledScan != null) {
                scheduledScan.cancel(false);
            }
            log.info("PendingOrderScanner stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // After recovery has reinstalled active orders
        return Integer.MAX_VALUE - 100;
    }

    /**
     * One pass over the active orders.
     *
     * @return the number of orders that received a fill
     */
    public int scan() {
        List<Order> active = orderLifecycleManager.getActiveOrders();
        int filled = 0;
        for (Order order : active) {
            try {
                if (orderLifecycleManager.attemptExecution(order.getId()).isPresent()) {
                    filled++;
                }
            } catch (BaseException e) {
                log.debug("Scan skipped order {}: {} {}", order.getId(), e.getErrorCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Scan failed for order {}: {}", order.getId(), e.getMessage(), e);
            }
        }
        if (filled > 0) {
            log.info("Pending order scan: active={} filled={}", active.size(), filled);
        }
        return filled;
    }
}
