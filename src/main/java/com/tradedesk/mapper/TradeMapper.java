package com.tradedesk.mapper;

import com.tradedesk.domain.model.Trade;
import com.tradedesk.domain.vo.ChargeBreakdown;
import com.tradedesk.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between Trade domain model and TradeEntity.
 *
 * <p>The domain model holds a single ChargeBreakdown VO while the entity has flat
 * commission, tax and totalCharges columns.
 */
@Mapper
public interface TradeMapper {

    @Mapping(source = "charges.commission", target = "commission")
    @Mapping(source = "charges.tax", target = "tax")
    @Mapping(
            target = "totalCharges",
            expression = "java(trade.getCharges() != null ? trade.getCharges().getTotal() : null)")
    TradeEntity toEntity(Trade trade);

    @Mapping(target = "charges", expression = "java(toChargeBreakdown(entity))")
    Trade toDomain(TradeEntity entity);

    List<Trade> toDomainList(List<TradeEntity> entities);

    /** Reassemble ChargeBreakdown VO from flat entity columns. */
    default ChargeBreakdown toChargeBreakdown(TradeEntity entity) {
        if (entity.getCommission() == null) {
            return ChargeBreakdown.zero();
        }
        return ChargeBreakdown.builder()
                .commission(entity.getCommission())
                .tax(entity.getTax())
                .build();
    }
}
