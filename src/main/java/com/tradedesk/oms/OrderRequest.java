package com.tradedesk.oms;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Parameters of a new order. The single input type of {@link OrderLifecycleManager#place}.
 *
 * <p>A null mode places the order in the manager's current default trading mode.
 */
@Data
@Builder
public class OrderRequest {

    private String symbol;
    private OrderSide side;
    private OrderType type;
    private int quantity;

    /** Required for LIMIT and STOP_LIMIT. */
    private BigDecimal limitPrice;

    /** Required for STOP_LOSS and STOP_LIMIT. */
    private BigDecimal stopPrice;

    private TradingMode mode;

    /** Optional good-till time. */
    private LocalDateTime expiresAt;
}
