package com.tradedesk.api.dto.request;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.TradingMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a pre-trade risk preview. Without a price the current market price is used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskCheckRequest {

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotNull(message = "Side is required")
    private OrderSide side;

    @Min(value = 1, message = "Quantity must be positive")
    private int quantity;

    @Positive(message = "Price must be positive")
    private BigDecimal price;

    @Builder.Default
    private TradingMode mode = TradingMode.SIMULATED;
}
