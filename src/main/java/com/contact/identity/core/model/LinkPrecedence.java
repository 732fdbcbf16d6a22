package com.contact.identity.core.model;

import java.util.Locale;

/**
 * Position of a contact within its identity cluster.
 */
public enum LinkPrecedence {
    /**
     * Root of a cluster. Has no linked id.
     */
    PRIMARY,

    /**
     * Member of a cluster, pointing directly at the cluster's primary.
     */
    SECONDARY;

    /**
     * Storage value, as written to the {@code link_precedence} column.
     */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LinkPrecedence fromDbValue(String value) {
        return LinkPrecedence.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
