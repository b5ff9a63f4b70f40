package com.pricemonitor.engine.domain.history;

import com.pricemonitor.common.event.Source;
import java.util.Map;
import lombok.Builder;

@Builder
public record StoreTotals(
        long products,
        long historyRecords,
        long changes,
        long anomalies,
        long alerts,
        Map<Source, Long> productsBySource) {

    public StoreTotals {
        productsBySource = productsBySource == null ? Map.of() : Map.copyOf(productsBySource);
    }
}
