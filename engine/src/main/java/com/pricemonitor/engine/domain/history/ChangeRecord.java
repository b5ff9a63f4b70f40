package com.pricemonitor.engine.domain.history;

import com.pricemonitor.common.event.ChangeKind;
import com.pricemonitor.common.event.Significance;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

/**
 * A classified transition between two consecutive history records of a product.
 * {@code fromSequence} is null for {@link ChangeKind#FIRST_SEEN}; {@code deltaPct} is null when the
 * previous price was zero.
 */
@Builder(toBuilder = true)
public record ChangeRecord(
        String id,
        String productId,
        Long fromSequence,
        long toSequence,
        ChangeKind kind,
        BigDecimal previousPrice,
        BigDecimal currentPrice,
        BigDecimal deltaAbs,
        BigDecimal deltaPct,
        Significance significance,
        boolean lowConfidence,
        String anomalyReason,
        Instant observedAt) {

    public boolean isDecrease() {
        return deltaAbs != null && deltaAbs.signum() < 0;
    }
}
