package com.pricemonitor.engine.infrastructure.db;

import com.pricemonitor.common.event.Source;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PriceHistoryJpaRepository extends JpaRepository<PriceHistoryRow, Long> {

    Optional<PriceHistoryRow> findFirstByProductIdOrderBySequenceDesc(String productId);

    List<PriceHistoryRow> findByProductIdOrderBySequenceDesc(String productId, Limit limit);

    long countByProductId(String productId);

    @Query("select count(h) as observations, min(h.price) as minPrice, max(h.price) as maxPrice, "
            + "sum(h.price) as totalPrice from PriceHistoryRow h where h.productId = :productId")
    PriceAggregateView aggregateByProductId(@Param("productId") String productId);

    @Query("select count(distinct h.productId) from PriceHistoryRow h")
    long countProducts();

    @Query("select h.source as source, count(distinct h.productId) as products from PriceHistoryRow h group by h.source")
    List<SourceCountView> countProductsBySource();

    interface PriceAggregateView {
        Long getObservations();

        BigDecimal getMinPrice();

        BigDecimal getMaxPrice();

        BigDecimal getTotalPrice();
    }

    interface SourceCountView {
        Source getSource();

        Long getProducts();
    }
}
