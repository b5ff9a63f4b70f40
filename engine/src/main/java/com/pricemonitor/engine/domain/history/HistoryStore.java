package com.pricemonitor.engine.domain.history;

import com.pricemonitor.common.event.AlertRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Append-only persistence of price history, classified changes and fired alerts.
 *
 * <p>Each call is atomic on its own. Implementations signal recoverable failures with
 * {@code TransientStoreException}, total loss of the store with {@code StoreUnavailableException},
 * and a duplicate {@code (productId, sequence)} with {@code InvariantViolationException}.
 */
public interface HistoryStore {

    /** Persists the record and returns the sequence it was stored under. */
    long append(HistoryRecord record);

    Optional<HistoryRecord> latest(String productId);

    /** Up to {@code size} most recent records, most recent first. */
    List<HistoryRecord> window(String productId, int size);

    void appendChange(ChangeRecord change);

    /** Returns false when an alert with the same idempotency key already exists. */
    boolean appendAlert(AlertRecord alert);

    Optional<Instant> lastFired(String ruleId, String productId);

    /**
     * Runs all writes of one accepted snapshot so that they are committed together or not at all.
     */
    default <T> T atomically(Supplier<T> work) {
        return work.get();
    }
}
