package com.pricemonitor.engine.infrastructure.db;

import com.pricemonitor.common.event.ChangeKind;
import com.pricemonitor.common.event.RuleKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "price_alerts")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PriceAlertRow {

    @Id
    @Column(name = "alert_id", length = 26)
    private String alertId;

    @Column(name = "idempotency_key", nullable = false, unique = true, length = 160)
    private String idempotencyKey;

    @Column(name = "rule_id", nullable = false, length = 64)
    private String ruleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "rule_kind", nullable = false, length = 32)
    private RuleKind ruleKind;

    @Column(name = "product_id", nullable = false, length = 32)
    private String productId;

    @Column(nullable = false)
    private long sequence;

    @Column(name = "change_record_ref", length = 26)
    private String changeRecordRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_kind", nullable = false, length = 16)
    private ChangeKind changeKind;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;

    @Column(nullable = false, length = 512)
    private String message;

    @Column(name = "price_at_trigger", nullable = false, precision = 14, scale = 4)
    private BigDecimal priceAtTrigger;

    @Column(length = 8)
    private String currency;

    @Column(length = 255)
    private String recipient;
}
