package com.tradedesk.domain.model;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A trading order and its fill progress.
 *
 * <p>Orders are created and mutated only by the OrderLifecycleManager. Callers receive
 * copies, so a returned Order is a snapshot and never changes underneath them.
 *
 * <p>{@code filledQuantity + remainingQuantity == quantity} holds after every transition.
 * The averageFillPrice is the VWAP across all fills.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String id;
    private String symbol;
    private OrderType type;
    private OrderSide side;
    private int quantity;

    /** Required for LIMIT and STOP_LIMIT orders. */
    private BigDecimal limitPrice;

    /** Required for STOP_LOSS and STOP_LIMIT orders. */
    private BigDecimal stopPrice;

    private TradingMode mode;

    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;

    private int filledQuantity;
    private int remainingQuantity;

    /** Volume-weighted average price across all fills. Null until the first fill. */
    private BigDecimal averageFillPrice;

    private String rejectionReason;

    private LocalDateTime createdAt;
    private LocalDateTime submittedAt;
    private LocalDateTime filledAt;
    private LocalDateTime cancelledAt;

    /** Good-till time. Null means the order stays active until filled or cancelled. */
    private LocalDateTime expiresAt;

    private LocalDateTime updatedAt;

    public Order copy() {
        return toBuilder().build();
    }
}
