package com.tradedesk.domain.model;

import com.tradedesk.domain.vo.ChargeBreakdown;
import java.math.BigDecimal;
import lombok.Value;

/** Result of a positive execution decision: price, quantity and fees of one fill. */
@Value
public class FillDecision {

    BigDecimal fillPrice;
    int quantity;
    ChargeBreakdown charges;
}
