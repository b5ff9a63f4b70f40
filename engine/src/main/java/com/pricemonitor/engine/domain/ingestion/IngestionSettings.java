package com.pricemonitor.engine.domain.ingestion;

import java.time.Duration;
import lombok.Builder;

/**
 * @param dedupTolerance    two snapshots of a product with the same price this close in time are one observation
 * @param reconfirmInterval an unchanged observation younger than this relative to the latest record is skipped
 * @param productTimeout    wall-clock budget for one product group
 */
@Builder(toBuilder = true)
public record IngestionSettings(Duration dedupTolerance, Duration reconfirmInterval, Duration productTimeout) {

    public static IngestionSettings defaults() {
        return new IngestionSettings(Duration.ZERO, Duration.ofHours(24), Duration.ofSeconds(30));
    }
}
