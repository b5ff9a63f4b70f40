package com.pricemonitor.engine.domain.ingestion;

import com.pricemonitor.common.event.AlertRecord;
import com.pricemonitor.common.event.ChangeKind;
import com.pricemonitor.engine.domain.anomaly.AnomalyDetector;
import com.pricemonitor.engine.domain.classification.ChangeClassifier;
import com.pricemonitor.engine.domain.exceptions.InvariantViolationException;
import com.pricemonitor.engine.domain.history.ChangeRecord;
import com.pricemonitor.engine.domain.history.HistoryRecord;
import com.pricemonitor.engine.domain.history.HistoryStore;
import com.pricemonitor.engine.domain.notification.AlertNotifier;
import com.pricemonitor.engine.domain.rule.AlertRule;
import com.pricemonitor.engine.domain.rule.AlertRuleEngine;
import com.pricemonitor.engine.domain.rule.RuleSource;
import com.pricemonitor.engine.domain.snapshot.ProductSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies the ordered, deduplicated snapshots of a single product to its history.
 *
 * <p>The latest record, the anomaly window and the last firing time of each rule are read once
 * and then kept current locally as records are appended, so a group costs three reads plus one
 * write unit per accepted snapshot. Each write unit (history record, optional change record,
 * fired alerts) goes through {@link HistoryStore#atomically} and is retried as a whole.
 */
@Slf4j
@RequiredArgsConstructor
public class ProductGroupProcessor {

    private final HistoryStore store;
    private final RuleSource ruleSource;
    private final ChangeClassifier classifier;
    private final AnomalyDetector anomalyDetector;
    private final AlertRuleEngine ruleEngine;
    private final AlertNotifier notifier;
    private final StoreRetrier retrier;
    private final ProductLockRegistry locks;
    private final Duration reconfirmInterval;

    public ProductOutcome process(String productId, List<ProductSnapshot> snapshots) throws InterruptedException {
        return locks.withLock(productId, () -> processLocked(productId, snapshots));
    }

    private ProductOutcome processLocked(String productId, List<ProductSnapshot> snapshots) {
        var latest = retrier.call("latest", () -> store.latest(productId)).orElse(null);
        var window = new ArrayList<>(retrier.call("window", () -> store.window(productId, anomalyDetector.windowSize())));
        var rules = retrier.call("rulesFor", () -> ruleSource.rulesFor(productId));
        var lastFired = lastFired(productId, rules);
        var latestFromThisRun = false;

        int accepted = 0;
        int skipped = 0;
        var changes = new ArrayList<ChangeRecord>();
        var alerts = new ArrayList<AlertRecord>();

        for (var snapshot : snapshots) {
            if (latest != null && shouldSkip(latest, snapshot, latestFromThisRun)) {
                skipped++;
                continue;
            }
            var record = toRecord(snapshot, latest == null ? 1 : latest.sequence() + 1);
            var change = classifier.classify(latest, record)
                    .map(c -> flagAnomaly(c, window, record));
            var candidates = change
                    .map(c -> ruleEngine.evaluate(c, snapshot, rules, lastFired))
                    .orElse(List.of());

            var committed = retrier.call("append", () -> store.atomically(() -> write(record, change, candidates)));

            latest = record;
            latestFromThisRun = true;
            window.add(0, record);
            if (window.size() > anomalyDetector.windowSize()) {
                window.remove(window.size() - 1);
            }
            accepted++;
            change.ifPresent(changes::add);
            for (var alert : committed) {
                lastFired.put(alert.ruleId(), alert.triggeredAt());
                alerts.add(alert);
                deliver(alert);
            }
        }
        log.debug("ingest.product.done: product_id={}, accepted={}, skipped={}, changes={}, alerts={}",
                productId, accepted, skipped, changes.size(), alerts.size());
        return new ProductOutcome(productId, true, accepted, skipped, changes, alerts);
    }

    private boolean shouldSkip(HistoryRecord latest, ProductSnapshot snapshot, boolean latestFromThisRun) {
        var observedAt = snapshot.observedAt();
        // Older than what is stored, or a replay of the stored instant from an earlier run
        if (observedAt.isBefore(latest.observedAt())
                || (!latestFromThisRun && observedAt.equals(latest.observedAt()))) {
            log.debug("ingest.snapshot.stale: product_id={}, observed_at={}, latest_observed_at={}",
                    latest.productId(), observedAt, latest.observedAt());
            return true;
        }
        var unchanged = latest.price().compareTo(snapshot.price()) == 0
                && Objects.equals(latest.availability(), snapshot.availability());
        if (unchanged && Duration.between(latest.observedAt(), observedAt).compareTo(reconfirmInterval) < 0) {
            log.debug("ingest.snapshot.unchanged: product_id={}, observed_at={}", latest.productId(), observedAt);
            return true;
        }
        return false;
    }

    private ChangeRecord flagAnomaly(ChangeRecord change, List<HistoryRecord> window, HistoryRecord record) {
        if (change.kind() == ChangeKind.FIRST_SEEN) {
            return change;
        }
        var verdict = anomalyDetector.check(window, record);
        if (!verdict.anomalous()) {
            return change;
        }
        log.info("ingest.anomaly: product_id={}, sequence={}, price={}, detail={}",
                record.productId(), record.sequence(), record.price(), verdict.describe());
        return change.toBuilder()
                .kind(ChangeKind.ANOMALY)
                .anomalyReason(verdict.describe())
                .build();
    }

    private List<AlertRecord> write(HistoryRecord record, Optional<ChangeRecord> change, List<AlertRecord> candidates) {
        var stored = store.append(record);
        if (stored != record.sequence()) {
            throw InvariantViolationException.sequenceMismatch(record.productId(), record.sequence(), stored);
        }
        change.ifPresent(store::appendChange);
        var committed = new ArrayList<AlertRecord>();
        for (var alert : candidates) {
            if (store.appendAlert(alert)) {
                committed.add(alert);
            } else {
                log.debug("ingest.alert.duplicate: idempotency_key={}", alert.idempotencyKey());
            }
        }
        return committed;
    }

    private Map<String, Instant> lastFired(String productId, List<AlertRule> rules) {
        var lastFired = new HashMap<String, Instant>();
        for (var rule : rules) {
            retrier.call("lastFired", () -> store.lastFired(rule.id(), productId))
                    .ifPresent(at -> lastFired.put(rule.id(), at));
        }
        return lastFired;
    }

    private void deliver(AlertRecord alert) {
        try {
            notifier.send(alert);
        } catch (RuntimeException e) {
            log.error("alert.notify.failed: alert_id={}, rule_id={}, product_id={}",
                    alert.alertId(), alert.ruleId(), alert.productId(), e);
        }
    }

    private static HistoryRecord toRecord(ProductSnapshot snapshot, long sequence) {
        return HistoryRecord.builder()
                .productId(snapshot.productId())
                .sequence(sequence)
                .observedAt(snapshot.observedAt())
                .price(snapshot.price())
                .currency(snapshot.currency())
                .availability(snapshot.availability())
                .source(snapshot.source())
                .quality(snapshot.quality())
                .build();
    }
}
