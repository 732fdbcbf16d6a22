package com.contact.identity.api;

import com.contact.identity.core.model.Contact;
import com.contact.identity.core.model.IdentifyOutcome;
import com.contact.identity.merge.ClusterMerge;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one committed reconciliation.
 *
 * @param contact        the consolidated cluster
 * @param outcome        what the reconciliation did
 * @param createdContact contact created by this call, if any
 * @param merges         primaries demoted by this call
 */
public record IdentifyResult(
        ContactSummary contact,
        IdentifyOutcome outcome,
        Optional<Contact> createdContact,
        List<ClusterMerge> merges
) {
    public IdentifyResult {
        Objects.requireNonNull(contact, "contact is required");
        Objects.requireNonNull(outcome, "outcome is required");
        createdContact = createdContact != null ? createdContact : Optional.empty();
        merges = merges != null ? List.copyOf(merges) : List.of();
    }

    public List<Long> demotedPrimaryIds() {
        return merges.stream().map(ClusterMerge::stalePrimaryId).toList();
    }

    public int relinkedCount() {
        return merges.stream().mapToInt(ClusterMerge::relinkedCount).sum();
    }
}
