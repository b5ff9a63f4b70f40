package com.pricemonitor.engine.domain.snapshot;

public record RejectedSnapshot(int arrivalIndex, String reason, String detail) implements NormalizationResult {

    public static final String MISSING_PRODUCT_ID = "missing_product_id";
    public static final String MISSING_PRICE = "missing_price";
    public static final String UNPARSEABLE_PRICE = "unparseable_price";
    public static final String NEGATIVE_PRICE = "negative_price";
    public static final String MISSING_OBSERVED_AT = "missing_observed_at";
    public static final String UNPARSEABLE_OBSERVED_AT = "unparseable_observed_at";
    public static final String INVALID_RECORD = "invalid_record";
}
