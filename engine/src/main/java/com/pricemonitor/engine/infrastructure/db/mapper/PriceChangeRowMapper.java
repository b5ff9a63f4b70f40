package com.pricemonitor.engine.infrastructure.db.mapper;

import com.pricemonitor.engine.domain.history.ChangeRecord;
import com.pricemonitor.engine.infrastructure.db.PriceChangeRow;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface PriceChangeRowMapper {

    PriceChangeRow toRow(ChangeRecord change);

    ChangeRecord toDomain(PriceChangeRow row);
}
