package com.pricemonitor.engine.infrastructure.db.mapper;

import com.pricemonitor.engine.domain.history.HistoryRecord;
import com.pricemonitor.engine.infrastructure.db.PriceHistoryRow;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface PriceHistoryRowMapper {

    @Mapping(target = "id", ignore = true)
    PriceHistoryRow toRow(HistoryRecord record);

    HistoryRecord toDomain(PriceHistoryRow row);
}
