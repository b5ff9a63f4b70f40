package com.pricemonitor.engine.domain.exceptions;

/**
 * Persistence cannot be reached at all. Aborts the whole batch.
 */
public class StoreUnavailableException extends RuntimeException {

    private StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StoreUnavailableException of(String operation, Throwable cause) {
        return new StoreUnavailableException("History store unavailable during " + operation, cause);
    }
}
