package com.pricemonitor.engine.infrastructure.db.mapper;

import com.pricemonitor.common.event.AlertRecord;
import com.pricemonitor.engine.infrastructure.db.PriceAlertRow;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface PriceAlertRowMapper {

    @Mapping(target = "idempotencyKey", expression = "java(alert.idempotencyKey())")
    PriceAlertRow toRow(AlertRecord alert);

    AlertRecord toDomain(PriceAlertRow row);
}
