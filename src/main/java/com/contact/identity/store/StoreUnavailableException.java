package com.contact.identity.store;

/**
 * Thrown when the store cannot be reached or rejects an operation.
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
