package com.projectpulse.core.store;

/**
 * The persistence layer could not be read or written. Fatal to the current cycle.
 */
public class StoreUnavailableException extends IllegalStateException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
