package com.pricemonitor.engine.domain.anomaly;

import com.pricemonitor.engine.domain.history.HistoryRecord;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Flags implausible prices against a product's recent history.
 *
 * <p>Two independent checks, both only once at least {@code minWindowSize} prior prices exist:
 * <ul>
 *   <li>z-score: {@code |price - mean| > k * stddev} over the last {@code windowSize} prior prices.
 *       A window with no spread at all (a price unchanged for weeks) uses
 *       {@code minRelativeDeviation * |mean|} in place of the zero deviation.</li>
 *   <li>jump: the price moved up or down by more than {@code jumpFactor} times the previous price,
 *       or fell to zero. This catches a scraper reading the wrong element.</li>
 * </ul>
 *
 * <p>Stateless: the window is supplied by the caller.
 */
@Slf4j
public class AnomalyDetector {

    private final AnomalySettings settings;

    public AnomalyDetector(AnomalySettings settings) {
        this.settings = Objects.requireNonNull(settings, "AnomalySettings must not be null");
        if (settings.minWindowSize() < 2) {
            throw new IllegalArgumentException("minWindowSize must be >= 2, got: " + settings.minWindowSize());
        }
        if (settings.windowSize() < settings.minWindowSize()) {
            throw new IllegalArgumentException("windowSize (" + settings.windowSize()
                    + ") must be >= minWindowSize (" + settings.minWindowSize() + ")");
        }
    }

    public int windowSize() {
        return settings.windowSize();
    }

    /**
     * @param window  prior records of the product, most recent first, not including {@code current}
     * @param current the record being checked
     */
    public AnomalyVerdict check(List<HistoryRecord> window, HistoryRecord current) {
        if (window.size() < settings.minWindowSize()) {
            return AnomalyVerdict.none();
        }
        var prices = window.stream()
                .limit(settings.windowSize())
                .mapToDouble(r -> r.price().doubleValue())
                .toArray();
        double value = current.price().doubleValue();
        double mean = mean(prices);
        double stddev = stddev(prices, mean);

        double previous = prices[0];
        if (previous > 0) {
            double ratio = value == 0 ? Double.POSITIVE_INFINITY : Math.max(value / previous, previous / value);
            if (ratio > settings.jumpFactor()) {
                log.debug("anomaly.jump: product_id={}, previous={}, current={}", current.productId(), previous, value);
                return new AnomalyVerdict(true, AnomalyVerdict.Reason.JUMP, mean, stddev, ratio);
            }
        }

        double effectiveStddev = stddev > 0 ? stddev : settings.minRelativeDeviation() * Math.abs(mean);
        double deviation = Math.abs(value - mean);
        if (effectiveStddev == 0) {
            return deviation == 0
                    ? AnomalyVerdict.none()
                    : new AnomalyVerdict(true, AnomalyVerdict.Reason.Z_SCORE, mean, stddev, Double.POSITIVE_INFINITY);
        }
        double score = deviation / effectiveStddev;
        if (score > settings.deviationFactor()) {
            log.debug("anomaly.z_score: product_id={}, value={}, mean={}, stddev={}, score={}",
                    current.productId(), value, mean, stddev, score);
            return new AnomalyVerdict(true, AnomalyVerdict.Reason.Z_SCORE, mean, stddev, score);
        }
        return AnomalyVerdict.none();
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double stddev(double[] values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }
}
