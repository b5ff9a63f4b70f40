package com.pricemonitor.engine.domain.ingestion;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation of an ingest run. Checked before each product group starts; a group
 * already in progress always finishes its current snapshot.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
