package com.pricemonitor.engine.domain.ingestion;

import com.pricemonitor.common.event.AlertRecord;
import com.pricemonitor.engine.domain.history.ChangeRecord;
import java.util.List;

/**
 * What one product group contributed to a run. {@code started} is false when the group was
 * cancelled before it began.
 */
public record ProductOutcome(
        String productId,
        boolean started,
        int accepted,
        int skipped,
        List<ChangeRecord> changes,
        List<AlertRecord> alerts) {

    public static ProductOutcome notStarted(String productId) {
        return new ProductOutcome(productId, false, 0, 0, List.of(), List.of());
    }
}
