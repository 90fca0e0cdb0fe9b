package com.tradedesk.repository.jpa;

import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.entity.LotEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the lots table.
 */
@Repository
public interface LotJpaRepository extends JpaRepository<LotEntity, String> {

    List<LotEntity> findBySymbolAndModeOrderByAcquiredAtAscSequenceAsc(String symbol, TradingMode mode);

    List<LotEntity> findByModeOrderByAcquiredAtAscSequenceAsc(TradingMode mode);

    List<LotEntity> findByRemainingQuantityGreaterThan(int quantity);
}
