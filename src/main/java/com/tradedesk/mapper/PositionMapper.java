package com.tradedesk.mapper;

import com.tradedesk.domain.model.Position;
import com.tradedesk.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between Position domain model and PositionEntity.
 *
 * <p>The entity id is the position key string ("SYMBOL:MODE"); direction, flatness and
 * market value are derived on the domain side and not stored.
 */
@Mapper
public interface PositionMapper {

    @Mapping(target = "positionKey", expression = "java(position.getKey().toString())")
    PositionEntity toEntity(Position position);

    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);
}
