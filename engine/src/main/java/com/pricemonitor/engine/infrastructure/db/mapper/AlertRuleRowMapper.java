package com.pricemonitor.engine.infrastructure.db.mapper;

import com.pricemonitor.engine.domain.rule.AlertRule;
import com.pricemonitor.engine.infrastructure.db.AlertRuleRow;
import java.time.Duration;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring", imports = Duration.class)
public interface AlertRuleRowMapper {

    @Mapping(target = "cooldown", expression = "java(Duration.ofSeconds(row.getCooldownSeconds()))")
    AlertRule toDomain(AlertRuleRow row);

    @Mapping(target = "cooldownSeconds", expression = "java(rule.cooldown().toSeconds())")
    AlertRuleRow toRow(AlertRule rule);
}
