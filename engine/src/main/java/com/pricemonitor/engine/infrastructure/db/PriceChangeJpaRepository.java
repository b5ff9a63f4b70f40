package com.pricemonitor.engine.infrastructure.db;

import com.pricemonitor.common.event.ChangeKind;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PriceChangeJpaRepository extends JpaRepository<PriceChangeRow, String> {

    List<PriceChangeRow> findByProductIdOrderByToSequenceAsc(String productId);

    long countByKind(ChangeKind kind);
}
