package com.tradedesk.repository.jpa;

import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.entity.OrderEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the orders table.
 * Active orders are also held in memory by the lifecycle manager; this table is the durable copy
 * reloaded on startup and queried for history.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    List<OrderEntity> findByStatusIn(List<OrderStatus> statuses);

    @Query("SELECT o FROM OrderEntity o WHERE (:symbol IS NULL OR o.symbol = :symbol)"
            + " AND (:mode IS NULL OR o.mode = :mode) ORDER BY o.createdAt DESC")
    List<OrderEntity> findHistory(
            @Param("symbol") String symbol, @Param("mode") TradingMode mode, Pageable pageable);
}
