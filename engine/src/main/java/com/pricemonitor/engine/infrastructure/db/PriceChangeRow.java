package com.pricemonitor.engine.infrastructure.db;

import com.pricemonitor.common.event.ChangeKind;
import com.pricemonitor.common.event.Significance;
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
@Table(name = "price_changes")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PriceChangeRow {

    @Id
    @Column(length = 26)
    private String id;

    @Column(name = "product_id", nullable = false, length = 32)
    private String productId;

    @Column(name = "from_sequence")
    private Long fromSequence;

    @Column(name = "to_sequence", nullable = false)
    private long toSequence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ChangeKind kind;

    @Column(name = "previous_price", precision = 14, scale = 4)
    private BigDecimal previousPrice;

    @Column(name = "current_price", nullable = false, precision = 14, scale = 4)
    private BigDecimal currentPrice;

    @Column(name = "delta_abs", precision = 14, scale = 4)
    private BigDecimal deltaAbs;

    @Column(name = "delta_pct", precision = 24, scale = 6)
    private BigDecimal deltaPct;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Significance significance;

    @Column(name = "low_confidence", nullable = false)
    private boolean lowConfidence;

    @Column(name = "anomaly_reason", length = 255)
    private String anomalyReason;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;
}
