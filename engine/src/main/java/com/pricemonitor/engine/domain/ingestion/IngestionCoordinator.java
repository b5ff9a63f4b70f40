package com.pricemonitor.engine.domain.ingestion;

import com.pricemonitor.common.event.AlertRecord;
import com.pricemonitor.common.event.ChangeKind;
import com.pricemonitor.engine.domain.exceptions.InvariantViolationException;
import com.pricemonitor.engine.domain.exceptions.StoreUnavailableException;
import com.pricemonitor.engine.domain.exceptions.TransientStoreException;
import com.pricemonitor.engine.domain.snapshot.ProductSnapshot;
import com.pricemonitor.engine.domain.snapshot.RejectedSnapshot;
import com.pricemonitor.engine.domain.snapshot.SnapshotNormalizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the engine: turns one batch of raw scraped records into history, change records
 * and alerts.
 *
 * <p>Records are normalized, grouped by product, ordered by observation time then arrival, and
 * deduplicated. Each product group then runs as one task on the worker pool; products never share
 * a task, and {@link ProductLockRegistry} keeps overlapping runs off the same product. A failing
 * group is reported and the others carry on. Only {@link StoreUnavailableException} escapes, after
 * the groups already running have settled.
 */
@Slf4j
public class IngestionCoordinator {

    private static final Comparator<ProductSnapshot> PROCESSING_ORDER = Comparator
            .comparing(ProductSnapshot::observedAt)
            .thenComparingInt(ProductSnapshot::arrivalIndex);

    private final SnapshotNormalizer normalizer;
    private final ProductGroupProcessor processor;
    private final IngestionSettings settings;
    private final ExecutorService workers;

    public IngestionCoordinator(
            SnapshotNormalizer normalizer,
            ProductGroupProcessor processor,
            IngestionSettings settings,
            ExecutorService workers) {
        this.normalizer = normalizer;
        this.processor = processor;
        this.settings = settings;
        this.workers = workers;
    }

    public IngestReport ingest(List<? extends Map<String, ?>> batch) {
        return ingest(batch, CancellationToken.none());
    }

    public IngestReport ingest(List<? extends Map<String, ?>> batch, CancellationToken cancellation) {
        var rejections = new ArrayList<RejectedSnapshot>();
        var groups = new LinkedHashMap<String, List<ProductSnapshot>>();
        for (int i = 0; i < batch.size(); i++) {
            var result = normalizer.normalize(batch.get(i), i);
            if (result instanceof ProductSnapshot snapshot) {
                groups.computeIfAbsent(snapshot.productId(), id -> new ArrayList<>()).add(snapshot);
            } else {
                rejections.add((RejectedSnapshot) result);
            }
        }

        int duplicates = 0;
        for (var entry : groups.entrySet()) {
            var ordered = deduplicate(entry.getValue());
            duplicates += entry.getValue().size() - ordered.size();
            entry.setValue(ordered);
        }

        var aborted = new AtomicBoolean();
        var futures = new LinkedHashMap<String, Future<ProductOutcome>>();
        groups.forEach((productId, snapshots) -> futures.put(productId, workers.submit(() -> {
            if (cancellation.isCancelled() || aborted.get()) {
                return ProductOutcome.notStarted(productId);
            }
            return processor.process(productId, snapshots);
        })));

        var report = new ReportAccumulator();
        StoreUnavailableException unavailable = null;
        for (var entry : futures.entrySet()) {
            var productId = entry.getKey();
            try {
                report.add(await(entry.getValue(), settings.productTimeout()));
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                report.error(productId, ProductError.TIMEOUT,
                        "No result within " + settings.productTimeout(), e);
            } catch (CancellationException e) {
                report.notStarted();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel();
                futures.values().forEach(f -> f.cancel(true));
                report.notStarted();
            } catch (ExecutionException e) {
                var cause = e.getCause();
                if (cause instanceof StoreUnavailableException storeDown) {
                    aborted.set(true);
                    unavailable = unavailable == null ? storeDown : unavailable;
                    report.error(productId, ProductError.STORE_UNAVAILABLE, cause.getMessage(), cause);
                } else if (cause instanceof TransientStoreException) {
                    report.error(productId, ProductError.TRANSIENT_STORE, cause.getMessage(), cause);
                } else if (cause instanceof InvariantViolationException) {
                    report.error(productId, ProductError.INVARIANT_VIOLATION, cause.getMessage(), cause);
                } else if (cause instanceof InterruptedException) {
                    report.notStarted();
                } else {
                    report.error(productId, ProductError.UNEXPECTED, String.valueOf(cause), cause);
                }
            }
        }

        var result = report.build(batch.size(), duplicates, rejections, cancellation.isCancelled());
        if (unavailable != null) {
            log.error("ingest.aborted: received={}, accepted={}, errors={}",
                    result.received(), result.accepted(), result.errors().size());
            throw unavailable;
        }
        log.info("ingest.completed: received={}, accepted={}, skipped={}, duplicates={}, rejected={}, "
                        + "changes={}, anomalies={}, alerts={}, errors={}, cancelled={}",
                result.received(), result.accepted(), result.skipped(), result.duplicates(), result.rejected(),
                result.changes(), result.anomalies(), result.alertsFired(), result.errors().size(),
                result.cancelled());
        return result;
    }

    /**
     * Orders a product's snapshots and drops retries: a snapshot with the same price as an earlier
     * kept one and an observation time within the dedup tolerance of it.
     */
    List<ProductSnapshot> deduplicate(List<ProductSnapshot> snapshots) {
        var ordered = new ArrayList<>(snapshots);
        ordered.sort(PROCESSING_ORDER);
        var kept = new ArrayList<ProductSnapshot>(ordered.size());
        for (var candidate : ordered) {
            var duplicate = kept.stream().anyMatch(k -> k.price().compareTo(candidate.price()) == 0
                    && Duration.between(k.observedAt(), candidate.observedAt()).abs()
                            .compareTo(settings.dedupTolerance()) <= 0);
            if (duplicate) {
                log.debug("ingest.snapshot.duplicate: product_id={}, index={}",
                        candidate.productId(), candidate.arrivalIndex());
            } else {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private static ProductOutcome await(Future<ProductOutcome> future, Duration timeout)
            throws InterruptedException, ExecutionException, TimeoutException {
        return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static final class ReportAccumulator {

        private int accepted;
        private int skipped;
        private int changes;
        private int anomalies;
        private int notStarted;
        private final List<AlertRecord> alerts = new ArrayList<>();
        private final List<ProductError> errors = new ArrayList<>();

        void add(ProductOutcome outcome) {
            if (!outcome.started()) {
                notStarted++;
                return;
            }
            accepted += outcome.accepted();
            skipped += outcome.skipped();
            changes += outcome.changes().size();
            anomalies += (int) outcome.changes().stream().filter(c -> c.kind() == ChangeKind.ANOMALY).count();
            alerts.addAll(outcome.alerts());
        }

        void notStarted() {
            notStarted++;
        }

        void error(String productId, String type, String reason, Throwable cause) {
            log.error("ingest.product.failed: product_id={}, type={}, reason={}", productId, type, reason, cause);
            errors.add(new ProductError(productId, type, reason));
        }

        IngestReport build(int received, int duplicates, List<RejectedSnapshot> rejections, boolean cancelled) {
            return IngestReport.builder()
                    .received(received)
                    .accepted(accepted)
                    .skipped(skipped)
                    .duplicates(duplicates)
                    .rejected(rejections.size())
                    .rejections(rejections)
                    .changes(changes)
                    .anomalies(anomalies)
                    .alertsFired(alerts.size())
                    .alerts(alerts)
                    .errors(errors)
                    .cancelled(cancelled)
                    .productsNotStarted(notStarted)
                    .build();
        }
    }
}
