package com.tradedesk.entity;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.TradingMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table. Insert-only: one row per fill.
 * Charges are stored as flat columns and reassembled by TradeMapper.
 */
@Entity
@Table(name = "trades")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "order_id", length = 36, nullable = false)
    private String orderId;

    @Column(length = 20, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "trading_mode", columnDefinition = "varchar(20)")
    private TradingMode mode;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderSide side;

    private int quantity;

    @Column(name = "fill_price", precision = 19, scale = 4)
    private BigDecimal fillPrice;

    @Column(precision = 15, scale = 2)
    private BigDecimal commission;

    @Column(precision = 15, scale = 2)
    private BigDecimal tax;

    @Column(name = "total_charges", precision = 15, scale = 2)
    private BigDecimal totalCharges;

    @Column(name = "realized_pnl", precision = 19, scale = 4)
    private BigDecimal realizedPnl;

    @Column(name = "executed_at")
    private LocalDateTime executedAt;
}
