package com.pricemonitor.engine.domain.exceptions;

import java.math.BigDecimal;

/**
 * Persisted or in-flight state for one product contradicts an engine invariant.
 * Stops processing of that product only.
 */
public class InvariantViolationException extends RuntimeException {

    private InvariantViolationException(String message) {
        super(message);
    }

    private InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static InvariantViolationException sequenceMismatch(String productId, long expected, long actual) {
        return new InvariantViolationException(
                "Sequence for product " + productId + " expected " + expected + " but store assigned " + actual);
    }

    public static InvariantViolationException sequenceConflict(String productId, long sequence, Throwable cause) {
        return new InvariantViolationException(
                "Sequence " + sequence + " already exists for product " + productId, cause);
    }

    public static InvariantViolationException nonMonotonic(String productId, long previous, long current) {
        return new InvariantViolationException(
                "Sequence for product " + productId + " went from " + previous + " to " + current);
    }

    public static InvariantViolationException negativePrice(String productId, BigDecimal price) {
        return new InvariantViolationException("Negative price " + price + " reached classifier for " + productId);
    }
}
