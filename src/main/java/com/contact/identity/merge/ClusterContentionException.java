package com.contact.identity.merge;

/**
 * Cluster roots kept moving under concurrent merges while they were being
 * locked. Re-running the whole reconciliation is safe.
 */
public class ClusterContentionException extends RuntimeException {

    public ClusterContentionException(String message) {
        super(message);
    }
}
