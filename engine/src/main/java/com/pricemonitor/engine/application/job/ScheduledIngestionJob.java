package com.pricemonitor.engine.application.job;

import com.pricemonitor.common.event.AlertRecord;
import com.pricemonitor.engine.application.config.IngestMetrics;
import com.pricemonitor.engine.domain.exceptions.StoreUnavailableException;
import com.pricemonitor.engine.domain.exceptions.TransientStoreException;
import com.pricemonitor.engine.domain.history.PriceStatistics;
import com.pricemonitor.engine.domain.ingestion.IngestReport;
import com.pricemonitor.engine.domain.ingestion.IngestionCoordinator;
import com.pricemonitor.engine.infrastructure.batch.BatchFileException;
import com.pricemonitor.engine.infrastructure.batch.BatchInbox;
import com.pricemonitor.engine.infrastructure.batch.JsonBatchFileReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Ingests every batch file waiting in the inbox, one {@code ingest} call per file.
 * A file that cannot be parsed, or whose batch hit an unreachable store, goes to {@code failed};
 * after a store outage the remaining files are left for the next run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledIngestionJob {

    private final BatchInbox inbox;
    private final JsonBatchFileReader reader;
    private final IngestionCoordinator coordinator;
    private final IngestMetrics metrics;
    private final PriceStatistics statistics;

    private final AtomicBoolean running = new AtomicBoolean();

    @Scheduled(cron = "${engine.batch.cron}")
    public void run() {
        if (!running.compareAndSet(false, true)) {
            log.info("ingest.job.skipped: reason=previous_run_in_progress");
            return;
        }
        try {
            var reports = drainInbox();
            log.info("ingest.job.done: files={}", reports.size());
            if (!reports.isEmpty()) {
                logStatistics(reports);
            }
        } finally {
            running.set(false);
        }
    }

    List<IngestReport> drainInbox() {
        var reports = new ArrayList<IngestReport>();
        for (var file : inbox.pending()) {
            try {
                reports.add(ingestFile(file));
                inbox.markProcessed(file);
            } catch (BatchFileException e) {
                log.error("ingest.file.failed: file={}, reason={}", file.getFileName(), e.getMessage(), e);
                metrics.failedBatches().increment();
                inbox.markFailed(file);
            } catch (StoreUnavailableException e) {
                log.error("ingest.file.aborted: file={}, reason={}", file.getFileName(), e.getMessage(), e);
                metrics.failedBatches().increment();
                inbox.markFailed(file);
                break;
            }
        }
        return reports;
    }

    /** Price statistics of every product that alerted in this run, then store-wide totals. */
    void logStatistics(List<IngestReport> reports) {
        try {
            reports.stream()
                    .flatMap(report -> report.alerts().stream())
                    .map(AlertRecord::productId)
                    .distinct()
                    .forEach(productId -> statistics.forProduct(productId).ifPresent(stats -> log.info(
                            "product.stats: product_id={}, observations={}, min={}, max={}, avg={}, last={}, volatility={}",
                            stats.productId(), stats.observations(), stats.minPrice(), stats.maxPrice(),
                            stats.avgPrice(), stats.lastPrice(), stats.volatility())));
            var totals = statistics.totals();
            log.info("store.totals: products={}, history_records={}, changes={}, anomalies={}, alerts={}, by_source={}",
                    totals.products(), totals.historyRecords(), totals.changes(), totals.anomalies(),
                    totals.alerts(), totals.productsBySource());
        } catch (TransientStoreException | StoreUnavailableException e) {
            log.warn("store.stats.unavailable: reason={}", e.getMessage(), e);
        }
    }

    private IngestReport ingestFile(Path file) {
        var records = reader.read(file);
        log.info("ingest.file.started: file={}, records={}", file.getFileName(), records.size());
        var report = coordinator.ingest(records);
        metrics.record(report);
        if (report.hasErrors()) {
            report.errors().forEach(error -> log.warn("ingest.file.product_error: file={}, product_id={}, type={}, reason={}",
                    file.getFileName(), error.productId(), error.errorType(), error.reason()));
        }
        return report;
    }
}
