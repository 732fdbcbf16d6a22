package com.contact.identity.store;

/**
 * Thrown when a store call or a store-level lock does not complete in time.
 */
public class StoreTimeoutException extends StoreException {

    public StoreTimeoutException(String message) {
        super(message);
    }

    public StoreTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
