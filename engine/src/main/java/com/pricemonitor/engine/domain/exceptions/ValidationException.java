package com.pricemonitor.engine.domain.exceptions;

import lombok.Getter;

/**
 * A raw scraped record that cannot become a snapshot. {@link #getReason()} is the
 * stable rejection code reported in the ingest report.
 */
@Getter
public class ValidationException extends RuntimeException {

    private final String reason;

    private ValidationException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static ValidationException missingField(String reason, String field) {
        return new ValidationException(reason, "Missing required field: " + field);
    }

    public static ValidationException unparseable(String reason, Object value) {
        return new ValidationException(reason, "Cannot parse value: " + value);
    }

    public static ValidationException negativePrice(Object value) {
        return new ValidationException("negative_price", "Price must not be negative: " + value);
    }
}
