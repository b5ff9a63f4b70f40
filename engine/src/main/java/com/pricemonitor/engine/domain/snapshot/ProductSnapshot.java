package com.pricemonitor.engine.domain.snapshot;

import com.pricemonitor.common.event.Source;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * One normalized observation of a product. {@code attributes} carries the scraper's
 * remaining fields (brand, category, name, ...) untouched.
 */
@Builder(toBuilder = true)
public record ProductSnapshot(
        String productId,
        String canonicalUrl,
        Instant observedAt,
        BigDecimal price,
        String currency,
        String availability,
        Source source,
        DataQuality quality,
        Map<String, Object> attributes,
        int arrivalIndex) implements NormalizationResult {

    public ProductSnapshot {
        Objects.requireNonNull(productId, "productId");
        Objects.requireNonNull(observedAt, "observedAt");
        Objects.requireNonNull(price, "price");
        source = source != null ? source : Source.OTHER;
        quality = quality != null ? quality : DataQuality.FAIR;
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String attribute(String name) {
        var value = attributes.get(name);
        return value != null ? value.toString() : null;
    }
}
