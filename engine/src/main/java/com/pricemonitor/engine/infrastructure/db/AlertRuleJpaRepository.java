package com.pricemonitor.engine.infrastructure.db;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AlertRuleJpaRepository extends JpaRepository<AlertRuleRow, String> {

    /** Active rules bound to the product plus every active rule scoped by category, brand or nothing. */
    @Query("select r from AlertRuleRow r where r.active = true and (r.productId = :productId or r.productId is null)")
    List<AlertRuleRow> findCandidates(@Param("productId") String productId);
}
