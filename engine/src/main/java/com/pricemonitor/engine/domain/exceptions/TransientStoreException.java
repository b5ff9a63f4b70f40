package com.pricemonitor.engine.domain.exceptions;

/**
 * A single store operation failed in a way that may succeed when retried (timeout,
 * dropped connection, lock wait).
 */
public class TransientStoreException extends RuntimeException {

    private TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public static TransientStoreException of(String operation, Throwable cause) {
        return new TransientStoreException("Transient failure during " + operation, cause);
    }

    public static TransientStoreException exhausted(String operation, int attempts, Throwable cause) {
        return new TransientStoreException(
                operation + " still failing after " + attempts + " attempts", cause);
    }
}
