package com.contact.identity.merge;

import com.contact.identity.core.model.Contact;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single cluster after merging: its primary and every non-deleted member,
 * the primary included, ordered by createdAt ascending then id ascending.
 */
public record ResolvedCluster(Contact primary, List<Contact> members, List<ClusterMerge> merges) {

    public ResolvedCluster {
        Objects.requireNonNull(primary, "primary is required");
        members = List.copyOf(members);
        merges = merges != null ? List.copyOf(merges) : List.of();
    }

    public boolean hasEmail(String email) {
        return members.stream().anyMatch(c -> c.getEmail().filter(email::equals).isPresent());
    }

    public boolean hasPhoneNumber(String phoneNumber) {
        return members.stream().anyMatch(c -> c.getPhoneNumber().filter(phoneNumber::equals).isPresent());
    }

    public boolean isMerged() {
        return !merges.isEmpty();
    }

    /**
     * Adds a contact created into this cluster during the same transaction.
     */
    public ResolvedCluster withMember(Contact created) {
        List<Contact> extended = new ArrayList<>(members);
        extended.add(created);
        extended.sort(Contact.SENIORITY);
        return new ResolvedCluster(primary, extended, merges);
    }
}
