package com.contact.identity.store;

/**
 * Thrown when the database aborts a transaction to break a deadlock or a
 * serialization conflict with a concurrent transaction. Nothing was committed,
 * so the whole unit can run again.
 */
public class StoreConflictException extends StoreException {

    public StoreConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
