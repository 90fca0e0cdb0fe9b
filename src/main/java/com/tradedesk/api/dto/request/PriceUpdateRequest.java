package com.tradedesk.api.dto.request;

import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for feeding market data. Either a single price, a close history (oldest first),
 * or both; a history is loaded before the price is applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceUpdateRequest {

    @Positive(message = "Price must be positive")
    private BigDecimal price;

    private List<@Positive BigDecimal> history;
}
