package com.contact.identity.api;

/**
 * The request cannot be reconciled as given: no identifier was supplied, or a
 * supplied identifier is not a string. Raised before any store access.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
