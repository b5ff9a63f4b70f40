package com.pricemonitor.common.event;

import com.pricemonitor.common.json.JacksonConfig;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlertRecordSerializationTest {

    private final ObjectMapper mapper = JacksonConfig.createObjectMapper();

    @Test
    void alertRecordUsesSnakeCaseFieldsAndKindNames() {
        var alert = AlertRecord.builder()
                .alertId("01J0000000000000000000000A")
                .ruleId("rule-7")
                .ruleKind(RuleKind.THRESHOLD_DROP_PCT)
                .productId("p-123")
                .sequence(2)
                .changeRecordRef("01J0000000000000000000000C")
                .changeKind(ChangeKind.PRICE_DROP)
                .triggeredAt(Instant.parse("2026-03-02T08:00:00Z"))
                .message("Price dropped 20.0%")
                .priceAtTrigger(new BigDecimal("40.00"))
                .currency("MAD")
                .build();

        var json = mapper.writeValueAsString(alert);

        assertThat(json).contains("\"rule_kind\":\"threshold_drop_pct\"");
        assertThat(json).contains("\"change_kind\":\"price_drop\"");
        assertThat(json).contains("\"idempotency_key\":\"rule-7:p-123:2\"");

        var read = mapper.readValue(json, AlertRecord.class);
        assertThat(read.priceAtTrigger()).isEqualByComparingTo("40.00");
        assertThat(read.triggeredAt()).isEqualTo(alert.triggeredAt());
        assertThat(read.ruleKind()).isEqualTo(RuleKind.THRESHOLD_DROP_PCT);
    }

    @Test
    void looseScraperJsonIsAccepted() {
        var raw = mapper.readValue("{\"price\": 12.50, \"extra\": [1, 2,],}", Map.class);

        assertThat(raw.get("price")).isInstanceOf(BigDecimal.class);
    }

    @Test
    void sourceResolvesHostsAndNames() {
        assertThat(Source.fromValue("www.jumia.ma")).isEqualTo(Source.JUMIA);
        assertThat(Source.fromValue("MarjaneMall")).isEqualTo(Source.MARJANEMALL);
        assertThat(Source.fromValue("amazon")).isEqualTo(Source.OTHER);
        assertThat(Source.fromValue(null)).isEqualTo(Source.OTHER);
    }
}
