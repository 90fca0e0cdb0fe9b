package com.tradedesk.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.model.Order;
import com.tradedesk.exception.ConcurrencyConflictException;
import com.tradedesk.oms.OrderExpiryMonitor;
import com.tradedesk.oms.OrderLifecycleManager;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrderExpiryMonitorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 2, 15, 30);

    @Mock
    private OrderLifecycleManager orderLifecycleManager;

    private OrderExpiryMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new OrderExpiryMonitor(orderLifecycleManager);
    }

    @Test
    @DisplayName("Expires only orders whose good-till time has been reached")
    void expiresDueOrders() {
        Order due = order("ord-due", NOW.minusMinutes(1));
        Order exact = order("ord-exact", NOW);
        Order later = order("ord-later", NOW.plusMinutes(1));
        Order open = order("ord-gtc", null);
        when(orderLifecycleManager.getActiveOrders()).thenReturn(List.of(due, exact, later, open));

        assertThat(monitor.expireDue(NOW)).isEqualTo(2);

        verify(orderLifecycleManager).expire("ord-due");
        verify(orderLifecycleManager).expire("ord-exact");
        verify(orderLifecycleManager, never()).expire("ord-later");
        verify(orderLifecycleManager, never()).expire("ord-gtc");
    }

    @Test
    @DisplayName("An order claimed by a concurrent fill is skipped")
    void skipsConflicts() {
        when(orderLifecycleManager.getActiveOrders()).thenReturn(List.of(order("ord-1", NOW.minusSeconds(5))));
        when(orderLifecycleManager.expire("ord-1")).thenThrow(new ConcurrencyConflictException("ord-1", "expire"));

        assertThat(monitor.expireDue(NOW)).isZero();
    }

    private static Order order(String id, LocalDateTime expiresAt) {
        return Order.builder()
                .id(id)
                .symbol("AAPL")
                .status(OrderStatus.SUBMITTED)
                .createdAt(NOW.minusHours(1))
                .expiresAt(expiresAt)
                .build();
    }
}
