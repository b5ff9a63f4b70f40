package com.pricemonitor.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

/**
 * A fired alert: persisted by the engine and handed to the notifier.
 * {@code sequence} is the history sequence of the transition that fired it.
 */
@Builder(toBuilder = true)
public record AlertRecord(
        @JsonProperty("alert_id") String alertId,
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("rule_kind") RuleKind ruleKind,
        @JsonProperty("product_id") String productId,
        long sequence,
        @JsonProperty("change_record_ref") String changeRecordRef,
        @JsonProperty("change_kind") ChangeKind changeKind,
        @JsonProperty("triggered_at") Instant triggeredAt,
        String message,
        @JsonProperty("price_at_trigger") BigDecimal priceAtTrigger,
        String currency,
        String recipient) {

    /** One alert per rule, product and transition. */
    @JsonProperty("idempotency_key")
    public String idempotencyKey() {
        return ruleId + ":" + productId + ":" + sequence;
    }
}
