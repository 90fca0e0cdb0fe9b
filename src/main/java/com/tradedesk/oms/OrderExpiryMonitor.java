package com.tradedesk.oms;

import com.tradedesk.domain.model.Order;
import com.tradedesk.exception.BaseException;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Expires active orders whose good-till time has passed.
 *
 * <p>Orders without an expiresAt never expire. Runs on a fixed delay of
 * {@code tradedesk.orders.expiry-check-ms}.
 */
@Component
public class OrderExpiryMonitor {

    private static final Logger log = LoggerFactory.getLogger(OrderExpiryMonitor.class);

    private final OrderLifecycleManager orderLifecycleManager;

    public OrderExpiryMonitor(OrderLifecycleManager orderLifecycleManager) {
        this.orderLifecycleManager = orderLifecycleManager;
    }

    @Scheduled(fixedDelayString = "${tradedesk.orders.expiry-check-ms:5000}")
    public void checkExpiries() {
        expireDue(LocalDateTime.now());
    }

    /** @return the number of orders expired */
    public int expireDue(LocalDateTime now) {
        List<Order> due = orderLifecycleManager.getActiveOrders().stream()
                .filter(order -> isExpired(order, now))
                .toList();

        int expired = 0;
        for (Order order : due) {
            try {
                orderLifecycleManager.expire(order.getId());
                expired++;
            } catch (BaseException e) {
                // A fill or cancel got there first; the next pass sees the new state
                log.debug("Expiry skipped order {}: {}", order.getId(), e.getMessage());
            }
        }
        return expired;
    }

    public boolean isExpired(Order order, LocalDateTime now) {
        return order.getExpiresAt() != null && !now.isBefore(order.getExpiresAt());
    }
}
