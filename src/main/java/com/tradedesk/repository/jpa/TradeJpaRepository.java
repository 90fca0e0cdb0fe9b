package com.tradedesk.repository.jpa;

import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.entity.TradeEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trades table. Rows are never updated.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    List<TradeEntity> findByOrderIdOrderByExecutedAtAsc(String orderId);

    @Query("SELECT t FROM TradeEntity t WHERE t.mode = :mode AND t.executedAt >= :from AND t.executedAt < :to"
            + " ORDER BY t.executedAt ASC")
    List<TradeEntity> findByModeAndDateRange(
            @Param("mode") TradingMode mode, @Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    @Query("SELECT t FROM TradeEntity t WHERE (:symbol IS NULL OR t.symbol = :symbol)"
            + " AND (:mode IS NULL OR t.mode = :mode) ORDER BY t.executedAt DESC")
    List<TradeEntity> findHistory(
            @Param("symbol") String symbol, @Param("mode") TradingMode mode, Pageable pageable);
}
