package com.tradedesk.api.dto.request;

import com.tradedesk.domain.enums.TradingMode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for switching the default trading mode. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TradingModeRequest {

    @NotNull(message = "Mode is required")
    private TradingMode mode;
}
