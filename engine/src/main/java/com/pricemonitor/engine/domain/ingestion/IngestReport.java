package com.pricemonitor.engine.domain.ingestion;

import com.pricemonitor.common.event.AlertRecord;
import com.pricemonitor.engine.domain.snapshot.RejectedSnapshot;
import java.util.List;
import lombok.Builder;

/**
 * Result of one {@code ingest} call. {@code accepted + skipped + duplicates + rejected} equals
 * {@code received} only when the run was neither cancelled nor had product errors.
 */
@Builder
public record IngestReport(
        int received,
        int accepted,
        int skipped,
        int duplicates,
        int rejected,
        List<RejectedSnapshot> rejections,
        int changes,
        int anomalies,
        int alertsFired,
        List<AlertRecord> alerts,
        List<ProductError> errors,
        boolean cancelled,
        int productsNotStarted) {

    public IngestReport {
        rejections = rejections == null ? List.of() : List.copyOf(rejections);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
