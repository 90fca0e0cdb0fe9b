package com.tradedesk.mapper;

import com.tradedesk.domain.model.Lot;
import com.tradedesk.entity.LotEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between Lot domain model and LotEntity. Field names match one to one.
 */
@Mapper
public interface LotMapper {

    LotEntity toEntity(Lot lot);

    Lot toDomain(LotEntity entity);

    List<Lot> toDomainList(List<LotEntity> entities);
}
