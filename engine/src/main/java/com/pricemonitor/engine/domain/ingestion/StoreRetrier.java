package com.pricemonitor.engine.domain.ingestion;

import com.pricemonitor.engine.domain.exceptions.TransientStoreException;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a store operation, retrying it with exponential backoff while it fails with
 * {@link TransientStoreException}. Any other exception is passed through on the first attempt.
 */
@Slf4j
@RequiredArgsConstructor
public class StoreRetrier {

    private final RetryPolicy policy;

    public <T> T call(String operation, Supplier<T> work) {
        TransientStoreException last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (attempt > 1) {
                pause(operation, attempt, last);
            }
            try {
                return work.get();
            } catch (TransientStoreException e) {
                last = e;
                log.warn("store.retry: operation={}, attempt={}/{}, reason={}",
                        operation, attempt, policy.maxAttempts(), e.getMessage());
            }
        }
        throw TransientStoreException.exhausted(operation, policy.maxAttempts(), last);
    }

    private void pause(String operation, int attempt, TransientStoreException cause) {
        var backoff = policy.backoffBefore(attempt);
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var interrupted = TransientStoreException.of(operation, e);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }
}
