package com.pricemonitor.engine.domain.history;

import com.pricemonitor.common.event.Source;
import com.pricemonitor.engine.domain.snapshot.DataQuality;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record HistoryRecord(
        String productId,
        long sequence,
        Instant observedAt,
        BigDecimal price,
        String currency,
        String availability,
        Source source,
        DataQuality quality) {
}
