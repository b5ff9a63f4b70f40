package com.pricemonitor.engine.domain.history;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import lombok.Builder;

/**
 * Summary of a product's recorded prices.
 *
 * @param volatility relative distance of the latest price from the average of all earlier ones,
 *                   zero with a single observation or an earlier average of zero
 */
@Builder(toBuilder = true)
public record ProductStats(
        String productId,
        long observations,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        BigDecimal avgPrice,
        BigDecimal lastPrice,
        Instant lastObservedAt,
        BigDecimal volatility) {

    private static final int SCALE = 6;

    /**
     * @param total sum of all recorded prices, {@code latest} included
     */
    public static ProductStats of(
            long observations, BigDecimal min, BigDecimal max, BigDecimal total, HistoryRecord latest) {
        var last = latest.price();
        var average = total.divide(BigDecimal.valueOf(observations), SCALE, RoundingMode.HALF_EVEN);
        var volatility = BigDecimal.ZERO;
        if (observations > 1) {
            var earlierAverage = total.subtract(last)
                    .divide(BigDecimal.valueOf(observations - 1), SCALE, RoundingMode.HALF_EVEN);
            if (earlierAverage.signum() > 0) {
                volatility = last.subtract(earlierAverage).abs().divide(earlierAverage, SCALE, RoundingMode.HALF_EVEN);
            }
        }
        return ProductStats.builder()
                .productId(latest.productId())
                .observations(observations)
                .minPrice(min)
                .maxPrice(max)
                .avgPrice(average)
                .lastPrice(last)
                .lastObservedAt(latest.observedAt())
                .volatility(volatility)
                .build();
    }
}
