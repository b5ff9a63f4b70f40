package com.pricemonitor.engine.domain.ingestion;

public record ProductError(String productId, String errorType, String reason) {

    public static final String TRANSIENT_STORE = "transient_store";
    public static final String INVARIANT_VIOLATION = "invariant_violation";
    public static final String STORE_UNAVAILABLE = "store_unavailable";
    public static final String TIMEOUT = "timeout";
    public static final String UNEXPECTED = "unexpected";
}
