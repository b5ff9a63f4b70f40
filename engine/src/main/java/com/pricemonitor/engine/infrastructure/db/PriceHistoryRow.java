package com.pricemonitor.engine.infrastructure.db;

import com.pricemonitor.common.event.Source;
import com.pricemonitor.engine.domain.snapshot.DataQuality;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "price_history",
        uniqueConstraints = @UniqueConstraint(name = "uq_price_history_product_sequence", columnNames = {"product_id", "sequence"}))
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PriceHistoryRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "product_id", nullable = false, length = 32)
    private String productId;

    @Column(nullable = false)
    private long sequence;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    @Column(nullable = false, precision = 14, scale = 4)
    private BigDecimal price;

    @Column(length = 8)
    private String currency;

    @Column(length = 32)
    private String availability;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Source source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DataQuality quality;
}
