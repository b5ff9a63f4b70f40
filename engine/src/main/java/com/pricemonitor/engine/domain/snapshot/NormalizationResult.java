package com.pricemonitor.engine.domain.snapshot;

/**
 * Outcome of normalizing one raw record: either an accepted snapshot or a rejection.
 */
public sealed interface NormalizationResult permits ProductSnapshot, RejectedSnapshot {

    /** Position of the raw record in its batch. */
    int arrivalIndex();
}
