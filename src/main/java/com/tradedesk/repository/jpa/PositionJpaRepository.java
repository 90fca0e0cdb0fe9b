package com.tradedesk.repository.jpa;

import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.entity.PositionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions table, keyed by "SYMBOL:MODE".
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, String> {

    List<PositionEntity> findByMode(TradingMode mode);
}
