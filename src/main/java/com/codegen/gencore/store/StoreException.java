package com.codegen.gencore.store;

/**
 * Raised when the storage medium behind a {@link RelationStore} fails.
 * Callers own retry and backoff.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
