package com.pricemonitor.engine.domain.anomaly;

import lombok.Builder;

/**
 * @param windowSize           number of prior prices the statistics are computed over
 * @param minWindowSize        below this many prior prices nothing is ever flagged
 * @param deviationFactor      k: flag when the price is more than k standard deviations from the mean
 * @param jumpFactor           flag when the price moves by more than this multiple of the last price
 * @param minRelativeDeviation deviation assumed for a flat window, as a fraction of the mean
 */
@Builder(toBuilder = true)
public record AnomalySettings(
        int windowSize,
        int minWindowSize,
        double deviationFactor,
        double jumpFactor,
        double minRelativeDeviation) {

    public static AnomalySettings defaults() {
        return new AnomalySettings(20, 5, 3.0, 10.0, 0.05);
    }
}
