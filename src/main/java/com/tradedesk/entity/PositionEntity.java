package com.tradedesk.entity;

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
 * JPA entity for the positions table. Keyed by "SYMBOL:MODE"; one row per position,
 * overwritten on every fill.
 */
@Entity
@Table(name = "positions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(name = "position_key", length = 40)
    private String positionKey;

    @Column(length = 20, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "trading_mode", columnDefinition = "varchar(20)")
    private TradingMode mode;

    private int quantity;

    @Column(name = "average_price", precision = 19, scale = 4)
    private BigDecimal averagePrice;

    @Column(name = "market_price", precision = 19, scale = 4)
    private BigDecimal marketPrice;

    @Column(name = "realized_pnl", precision = 19, scale = 4)
    private BigDecimal realizedPnl;

    @Column(name = "unrealized_pnl", precision = 19, scale = 4)
    private BigDecimal unrealizedPnl;

    @Column(name = "total_pnl", precision = 19, scale = 4)
    private BigDecimal totalPnl;

    @Column(name = "tax_liability", precision = 15, scale = 2)
    private BigDecimal taxLiability;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
