package com.pricemonitor.engine.infrastructure.db;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PriceAlertJpaRepository extends JpaRepository<PriceAlertRow, String> {

    /** Returns 0 when an alert with the same idempotency key is already stored. */
    @Modifying
    @Query(value = "INSERT INTO price_alerts (alert_id, idempotency_key, rule_id, rule_kind, product_id, sequence, "
            + "change_record_ref, change_kind, triggered_at, message, price_at_trigger, currency, recipient) "
            + "VALUES (:#{#row.alertId}, :#{#row.idempotencyKey}, :#{#row.ruleId}, :#{#row.ruleKind.name()}, "
            + ":#{#row.productId}, :#{#row.sequence}, :#{#row.changeRecordRef}, :#{#row.changeKind.name()}, "
            + ":#{#row.triggeredAt}, :#{#row.message}, :#{#row.priceAtTrigger}, :#{#row.currency}, :#{#row.recipient}) "
            + "ON CONFLICT (idempotency_key) DO NOTHING", nativeQuery = true)
    int insertIdempotent(@Param("row") PriceAlertRow row);

    @Query("select max(a.triggeredAt) from PriceAlertRow a where a.ruleId = :ruleId and a.productId = :productId")
    Optional<Instant> findLastTriggeredAt(@Param("ruleId") String ruleId, @Param("productId") String productId);

    List<PriceAlertRow> findByProductIdOrderByTriggeredAtAsc(String productId);
}
