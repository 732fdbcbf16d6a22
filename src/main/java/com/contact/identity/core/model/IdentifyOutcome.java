package com.contact.identity.core.model;

/**
 * What a reconciliation did to the store.
 */
public enum IdentifyOutcome {
    /** No contact matched; a fresh primary was created. */
    NEW_PRIMARY,
    /** The request added a new identifier to an existing cluster. */
    NEW_SECONDARY,
    /** Two or more clusters were joined under the oldest primary. */
    MERGED,
    /** Everything was already known; nothing was written. */
    MATCHED
}
