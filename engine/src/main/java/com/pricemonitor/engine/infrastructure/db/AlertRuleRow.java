package com.pricemonitor.engine.infrastructure.db;

import com.pricemonitor.common.event.RuleKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "alert_rules")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertRuleRow {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private RuleKind kind;

    @Column(name = "product_id", length = 32)
    private String productId;

    @Column(length = 128)
    private String category;

    @Column(length = 128)
    private String brand;

    @Column(precision = 14, scale = 4)
    private BigDecimal parameter;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "cooldown_seconds", nullable = false)
    private long cooldownSeconds;

    @Column(length = 255)
    private String recipient;
}
