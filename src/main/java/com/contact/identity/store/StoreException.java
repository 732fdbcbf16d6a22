package com.contact.identity.store;

/**
 * Base class for failures of the contact store. Any store failure aborts and
 * rolls back the transaction it happened in.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether re-running the whole reconciliation may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
