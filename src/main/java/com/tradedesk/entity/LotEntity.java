package com.tradedesk.entity;

import com.tradedesk.domain.enums.PositionDirection;
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
 * JPA entity for the lots table. Closed lots (remaining 0) are kept for tax reporting.
 */
@Entity
@Table(name = "lots")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LotEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 20, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "trading_mode", columnDefinition = "varchar(20)")
    private TradingMode mode;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private PositionDirection direction;

    @Column(name = "original_quantity")
    private int originalQuantity;

    @Column(name = "remaining_quantity")
    private int remainingQuantity;

    @Column(name = "sold_quantity")
    private int soldQuantity;

    @Column(name = "unit_cost", precision = 19, scale = 4)
    private BigDecimal unitCost;

    @Column(name = "acquired_at")
    private LocalDateTime acquiredAt;

    private long sequence;

    @Column(name = "realized_gain", precision = 19, scale = 4)
    private BigDecimal realizedGain;

    @Column(name = "tax_liability", precision = 15, scale = 2)
    private BigDecimal taxLiability;
}
