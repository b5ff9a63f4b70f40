package com.pricemonitor.engine.domain.ingestion;

import com.pricemonitor.common.event.AlertRecord;
import com.pricemonitor.engine.domain.exceptions.InvariantViolationException;
import com.pricemonitor.engine.domain.history.ChangeRecord;
import com.pricemonitor.engine.domain.history.HistoryRecord;
import com.pricemonitor.engine.domain.history.HistoryStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Test store with the same guarantees as the database: unique (product, sequence), unique alert
 * idempotency key, and all-or-nothing {@link #atomically}.
 */
class InMemoryHistoryStore implements HistoryStore {

    private final Map<String, List<HistoryRecord>> history = new HashMap<>();
    private final List<ChangeRecord> changes = new ArrayList<>();
    private final Map<String, AlertRecord> alerts = new LinkedHashMap<>();

    @Override
    public synchronized long append(HistoryRecord record) {
        var records = history.computeIfAbsent(record.productId(), id -> new ArrayList<>());
        var expected = records.isEmpty() ? 1 : records.get(records.size() - 1).sequence() + 1;
        if (record.sequence() != expected) {
            throw InvariantViolationException.sequenceConflict(record.productId(), record.sequence(), null);
        }
        records.add(record);
        return record.sequence();
    }

    @Override
    public synchronized Optional<HistoryRecord> latest(String productId) {
        var records = history.getOrDefault(productId, List.of());
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1));
    }

    @Override
    public synchronized List<HistoryRecord> window(String productId, int size) {
        var records = new ArrayList<>(history.getOrDefault(productId, List.of()));
        records.sort(Comparator.comparingLong(HistoryRecord::sequence).reversed());
        return List.copyOf(records.subList(0, Math.min(size, records.size())));
    }

    @Override
    public synchronized void appendChange(ChangeRecord change) {
        changes.add(change);
    }

    @Override
    public synchronized boolean appendAlert(AlertRecord alert) {
        return alerts.putIfAbsent(alert.idempotencyKey(), alert) == null;
    }

    @Override
    public synchronized Optional<Instant> lastFired(String ruleId, String productId) {
        return alerts.values().stream()
                .filter(a -> a.ruleId().equals(ruleId) && a.productId().equals(productId))
                .map(AlertRecord::triggeredAt)
                .max(Comparator.naturalOrder());
    }

    @Override
    public synchronized <T> T atomically(Supplier<T> work) {
        var historySizes = new HashMap<String, Integer>();
        history.forEach((id, records) -> historySizes.put(id, records.size()));
        var changeCount = changes.size();
        var alertKeys = new ArrayList<>(alerts.keySet());
        try {
            return work.get();
        } catch (RuntimeException e) {
            history.entrySet().removeIf(entry -> !historySizes.containsKey(entry.getKey()));
            history.forEach((id, records) -> records.subList(historySizes.get(id), records.size()).clear());
            changes.subList(changeCount, changes.size()).clear();
            alerts.keySet().retainAll(alertKeys);
            throw e;
        }
    }

    synchronized List<HistoryRecord> history(String productId) {
        return List.copyOf(history.getOrDefault(productId, List.of()));
    }

    synchronized int historySize() {
        return history.values().stream().mapToInt(List::size).sum();
    }

    synchronized Map<String, List<HistoryRecord>> allHistory() {
        var copy = new HashMap<String, List<HistoryRecord>>();
        history.forEach((id, records) -> copy.put(id, List.copyOf(records)));
        return copy;
    }

    synchronized List<ChangeRecord> changes() {
        return List.copyOf(changes);
    }

    synchronized List<AlertRecord> alerts() {
        return List.copyOf(alerts.values());
    }
}
