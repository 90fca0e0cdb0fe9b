package com.tradedesk.api.dto.request;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TradingMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for placing an order. Price requirements per order type are checked by the
 * lifecycle manager.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotNull(message = "Side is required")
    private OrderSide side;

    @NotNull(message = "Order type is required")
    private OrderType type;

    @Min(value = 1, message = "Quantity must be positive")
    private int quantity;

    @Positive(message = "Limit price must be positive")
    private BigDecimal limitPrice;

    @Positive(message = "Stop price must be positive")
    private BigDecimal stopPrice;

    /** Null uses the current default trading mode. */
    private TradingMode mode;

    private LocalDateTime expiresAt;
}
