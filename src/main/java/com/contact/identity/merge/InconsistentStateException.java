package com.contact.identity.merge;

/**
 * The stored link structure violates the cluster invariants, e.g. contacts
 * matched but none of their clusters has a primary. The request fails; the
 * data is not repaired automatically.
 */
public class InconsistentStateException extends RuntimeException {

    public InconsistentStateException(String message) {
        super(message);
    }
}
