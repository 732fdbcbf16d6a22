package com.contact.identity.api;

import java.util.List;

/**
 * Consolidated view of one cluster, as returned to callers.
 *
 * @param primaryContactId    id of the cluster's primary
 * @param emails              distinct emails, the primary's first
 * @param phoneNumbers        distinct phone numbers, the primary's first
 * @param secondaryContactIds secondaries in creation order
 */
public record ContactSummary(
        long primaryContactId,
        List<String> emails,
        List<String> phoneNumbers,
        List<Long> secondaryContactIds
) {
    public ContactSummary {
        emails = List.copyOf(emails);
        phoneNumbers = List.copyOf(phoneNumbers);
        secondaryContactIds = List.copyOf(secondaryContactIds);
    }

    public int clusterSize() {
        return 1 + secondaryContactIds.size();
    }
}
