package com.marginledger.mapper;

import com.marginledger.api.dto.response.AuditLogResponse;
import com.marginledger.api.dto.response.CloseSettlementResponse;
import com.marginledger.api.dto.response.OrderResponse;
import com.marginledger.api.dto.response.PositionResponse;
import com.marginledger.api.dto.response.TriggerResponse;
import com.marginledger.domain.model.CloseSettlement;
import com.marginledger.domain.model.Order;
import com.marginledger.domain.model.PositionView;
import com.marginledger.domain.model.Trigger;
import com.marginledger.entity.AuditLogEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from ledger records to REST response DTOs.
 *
 * <p>Position responses flatten the {@link PositionView} wrapper; audit responses expand
 * the context_json column back into a map.
 */
@Mapper(imports = JsonHelper.class)
public interface LedgerViewMapper {

    OrderResponse toResponse(Order order);

    List<OrderResponse> toOrderResponses(List<Order> orders);

    @Mapping(target = "id", source = "position.id")
    @Mapping(target = "account", source = "position.account")
    @Mapping(target = "assetId", source = "position.assetId")
    @Mapping(target = "direction", source = "position.direction")
    @Mapping(target = "openPrice", source = "position.openPrice")
    @Mapping(target = "margin", source = "position.margin")
    @Mapping(target = "size", source = "position.size")
    @Mapping(target = "leverage", source = "position.leverage")
    @Mapping(target = "openedAt", source = "position.openedAt")
    @Mapping(target = "sourceOrderId", source = "position.sourceOrderId")
    PositionResponse toResponse(PositionView positionView);

    List<PositionResponse> toPositionResponses(List<PositionView> positionViews);

    TriggerResponse toResponse(Trigger trigger);

    List<TriggerResponse> toTriggerResponses(List<Trigger> triggers);

    CloseSettlementResponse toResponse(CloseSettlement settlement);

    @Mapping(target = "context", expression = "java(JsonHelper.toMap(entity.getContextJson()))")
    AuditLogResponse toResponse(AuditLogEntity entity);

    List<AuditLogResponse> toAuditLogResponses(List<AuditLogEntity> entities);
}
