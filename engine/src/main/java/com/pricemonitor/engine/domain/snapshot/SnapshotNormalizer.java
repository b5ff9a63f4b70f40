package com.pricemonitor.engine.domain.snapshot;

import com.pricemonitor.common.event.Source;
import com.pricemonitor.engine.domain.exceptions.ValidationException;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates a raw scraper record and turns it into a {@link ProductSnapshot}. Never throws for bad
 * input: every problem becomes a {@link RejectedSnapshot} with a reason code.
 *
 * <p>Both scrapers' field names are understood ({@code scraped_at} for {@code observed_at},
 * {@code current_price} or {@code price_text} for {@code price}, {@code is_available} for
 * {@code availability}). Fields not consumed here are kept as opaque attributes.
 */
@Slf4j
public class SnapshotNormalizer {

    private static final List<String> URL_FIELDS = List.of("url", "product_url", "canonical_url");
    private static final List<String> ID_FIELDS = List.of("product_id", "sku", "id");
    private static final List<String> PRICE_FIELDS = List.of("price", "current_price", "price_text");
    private static final List<String> TIME_FIELDS = List.of("observed_at", "scraped_at");
    private static final List<String> AVAILABILITY_FIELDS =
            List.of("availability", "is_available", "in_stock", "stock_status");
    private static final Set<String> CONSUMED_FIELDS = Set.of(
            "url", "product_url", "canonical_url", "product_id", "sku", "id",
            "price", "current_price", "observed_at", "scraped_at", "currency", "source",
            "availability", "is_available", "in_stock", "stock_status");

    private static final long EPOCH_SECONDS_LIMIT = 100_000_000_000L;

    private final ProductIdentity identity;
    private final PriceParser priceParser;
    private final String defaultCurrency;

    public SnapshotNormalizer(NormalizerSettings settings) {
        this.identity = new ProductIdentity(settings.trackingParameters());
        this.priceParser = new PriceParser();
        this.defaultCurrency = settings.defaultCurrency();
    }

    public NormalizationResult normalize(Map<String, ?> raw, int arrivalIndex) {
        try {
            return toSnapshot(raw == null ? Map.of() : raw, arrivalIndex);
        } catch (ValidationException e) {
            log.warn("snapshot.rejected: index={}, reason={}, detail={}", arrivalIndex, e.getReason(), e.getMessage());
            return new RejectedSnapshot(arrivalIndex, e.getReason(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("snapshot.rejected: index={}, reason={}, detail={}",
                    arrivalIndex, RejectedSnapshot.INVALID_RECORD, e.toString(), e);
            return new RejectedSnapshot(arrivalIndex, RejectedSnapshot.INVALID_RECORD, e.toString());
        }
    }

    private ProductSnapshot toSnapshot(Map<String, ?> raw, int arrivalIndex) {
        var declaredSource = text(raw.get("source"));
        var url = first(raw, URL_FIELDS);
        var canonicalUrl = url != null ? identity.canonicalUrl(url.toString()).orElse(null) : null;
        var source = declaredSource != null
                ? Source.fromValue(declaredSource)
                : Source.fromValue(canonicalUrl);

        String productId;
        if (canonicalUrl != null) {
            productId = identity.idFor(canonicalUrl);
        } else {
            var fallbackId = text(first(raw, ID_FIELDS));
            if (fallbackId == null) {
                throw ValidationException.missingField(RejectedSnapshot.MISSING_PRODUCT_ID, "url");
            }
            productId = identity.idFor(source.key() + ":" + fallbackId);
        }

        var rawPrice = first(raw, PRICE_FIELDS);
        if (rawPrice == null) {
            throw ValidationException.missingField(RejectedSnapshot.MISSING_PRICE, "price");
        }
        var parsed = priceParser.parse(rawPrice);

        var rawTime = first(raw, TIME_FIELDS);
        if (rawTime == null) {
            throw ValidationException.missingField(RejectedSnapshot.MISSING_OBSERVED_AT, "observed_at");
        }

        var currency = text(raw.get("currency"));
        if (currency == null) {
            currency = parsed.currency() != null ? parsed.currency() : defaultCurrency;
        }

        var attributes = new LinkedHashMap<String, Object>();
        raw.forEach((key, value) -> {
            if (!CONSUMED_FIELDS.contains(key)) {
                attributes.put(key, value);
            }
        });

        return ProductSnapshot.builder()
                .productId(productId)
                .canonicalUrl(canonicalUrl)
                .observedAt(parseTimestamp(rawTime))
                .price(parsed.amount())
                .currency(currency.toUpperCase(Locale.ROOT))
                .availability(availability(first(raw, AVAILABILITY_FIELDS)))
                .source(source)
                .quality(assessQuality(raw))
                .attributes(attributes)
                .arrivalIndex(arrivalIndex)
                .build();
    }

    static Instant parseTimestamp(Object raw) {
        if (raw instanceof Instant instant) {
            return instant;
        }
        if (raw instanceof Number number) {
            try {
                var value = new BigDecimal(number.toString()).longValue();
                return value < EPOCH_SECONDS_LIMIT ? Instant.ofEpochSecond(value) : Instant.ofEpochMilli(value);
            } catch (NumberFormatException | DateTimeException e) {
                throw ValidationException.unparseable(RejectedSnapshot.UNPARSEABLE_OBSERVED_AT, raw);
            }
        }
        var text = raw.toString().trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + "T" + text.substring(11);
        }
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            var parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            return parsed instanceof ZonedDateTime zoned
                    ? zoned.toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw ValidationException.unparseable(RejectedSnapshot.UNPARSEABLE_OBSERVED_AT, raw);
        }
    }

    private static String availability(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Boolean available) {
            return available ? "in_stock" : "out_of_stock";
        }
        var value = raw.toString().trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        return switch (value) {
            case "true", "yes", "available", "instock" -> "in_stock";
            case "false", "no", "unavailable", "outofstock", "sold_out" -> "out_of_stock";
            default -> value.isEmpty() ? null : value;
        };
    }

    private static DataQuality assessQuality(Map<String, ?> raw) {
        var hasPriceText = text(raw.get("price_text")) != null;
        var hasCategory = text(raw.get("category")) != null;
        if (hasPriceText && hasCategory) {
            return DataQuality.EXCELLENT;
        }
        return hasPriceText || hasCategory ? DataQuality.GOOD : DataQuality.FAIR;
    }

    private static Object first(Map<String, ?> raw, List<String> fields) {
        for (var field : fields) {
            var value = raw.get(field);
            if (value != null && !(value instanceof String s && s.isBlank())) {
                return value;
            }
        }
        return null;
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        var text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
