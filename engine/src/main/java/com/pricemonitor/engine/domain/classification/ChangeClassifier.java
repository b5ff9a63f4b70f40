package com.pricemonitor.engine.domain.classification;

import com.pricemonitor.common.event.ChangeKind;
import com.pricemonitor.common.event.Significance;
import com.pricemonitor.common.id.UlidGenerator;
import com.pricemonitor.engine.domain.exceptions.InvariantViolationException;
import com.pricemonitor.engine.domain.history.ChangeRecord;
import com.pricemonitor.engine.domain.history.HistoryRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import lombok.RequiredArgsConstructor;

/**
 * Classifies the transition from the previous history record of a product to the current one.
 * An empty result means the price did not move by at least {@code epsilon} (relative), in which
 * case no change record is kept.
 */
@RequiredArgsConstructor
public class ChangeClassifier {

    static final int PCT_SCALE = 6;

    private final ClassifierSettings settings;

    /**
     * @param previous last stored record, or {@code null} if the product has no history
     * @param current  the record just appended
     */
    public Optional<ChangeRecord> classify(HistoryRecord previous, HistoryRecord current) {
        requireNonNegative(current);
        var builder = ChangeRecord.builder()
                .id(UlidGenerator.generate(current.observedAt()))
                .productId(current.productId())
                .toSequence(current.sequence())
                .currentPrice(current.price())
                .observedAt(current.observedAt());

        if (previous == null) {
            return Optional.of(builder
                    .kind(ChangeKind.FIRST_SEEN)
                    .significance(Significance.LOW)
                    .build());
        }
        requireNonNegative(previous);
        if (current.sequence() <= previous.sequence()) {
            throw InvariantViolationException.nonMonotonic(
                    current.productId(), previous.sequence(), current.sequence());
        }

        var deltaAbs = current.price().subtract(previous.price());
        if (deltaAbs.signum() == 0) {
            return Optional.empty();
        }
        builder.fromSequence(previous.sequence())
                .previousPrice(previous.price())
                .deltaAbs(deltaAbs);

        // No relative change can be computed from a zero baseline
        if (previous.price().signum() == 0) {
            return Optional.of(builder
                    .kind(ChangeKind.PRICE_RISE)
                    .significance(Significance.HIGH)
                    .lowConfidence(true)
                    .build());
        }

        var deltaPct = deltaAbs.divide(previous.price(), PCT_SCALE, RoundingMode.HALF_EVEN);
        ChangeKind kind;
        if (deltaPct.compareTo(settings.epsilon().negate()) <= 0) {
            kind = ChangeKind.PRICE_DROP;
        } else if (deltaPct.compareTo(settings.epsilon()) >= 0) {
            kind = ChangeKind.PRICE_RISE;
        } else {
            return Optional.empty();
        }

        return Optional.of(builder
                .kind(kind)
                .deltaPct(deltaPct)
                .significance(significanceOf(deltaPct))
                .build());
    }

    Significance significanceOf(BigDecimal deltaPct) {
        var magnitude = deltaPct.abs();
        if (magnitude.compareTo(settings.highSignificance()) > 0) {
            return Significance.HIGH;
        }
        if (magnitude.compareTo(settings.mediumSignificance()) > 0) {
            return Significance.MEDIUM;
        }
        return Significance.LOW;
    }

    private static void requireNonNegative(HistoryRecord record) {
        if (record.price() == null || record.price().signum() < 0) {
            throw InvariantViolationException.negativePrice(record.productId(), record.price());
        }
    }
}
