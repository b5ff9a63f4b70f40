package com.pricemonitor.engine.application.config;

import com.pricemonitor.engine.domain.ingestion.IngestReport;
import io.micrometer.core.instrument.Counter;

public record IngestMetrics(
        Counter received,
        Counter accepted,
        Counter skipped,
        Counter rejected,
        Counter changes,
        Counter anomalies,
        Counter alerts,
        Counter productErrors,
        Counter failedBatches) {

    public void record(IngestReport report) {
        received.increment(report.received());
        accepted.increment(report.accepted());
        skipped.increment(report.skipped() + report.duplicates());
        rejected.increment(report.rejected());
        changes.increment(report.changes());
        anomalies.increment(report.anomalies());
        alerts.increment(report.alertsFired());
        productErrors.increment(report.errors().size());
    }
}
