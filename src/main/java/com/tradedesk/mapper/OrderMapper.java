package com.tradedesk.mapper;

import com.tradedesk.domain.model.Order;
import com.tradedesk.entity.OrderEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between Order domain model and OrderEntity.
 *
 * <p>Domain uses 'type' for OrderType, entity uses 'orderType'.
 */
@Mapper
public interface OrderMapper {

    @Mapping(source = "type", target = "orderType")
    OrderEntity toEntity(Order order);

    @Mapping(source = "orderType", target = "type")
    Order toDomain(OrderEntity entity);

    List<Order> toDomainList(List<OrderEntity> entities);
}
