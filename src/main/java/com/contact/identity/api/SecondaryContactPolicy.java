package com.contact.identity.api;

import com.contact.identity.merge.ResolvedCluster;
import com.contact.identity.store.NewContact;

import java.util.Optional;

/**
 * Decides whether a request that matched an existing cluster brings new
 * information worth recording as a secondary contact.
 *
 * <p>A secondary is created only when the request supplied both identifiers
 * and at least one of them is unknown to the cluster. A single identifier that
 * matched carries nothing new.</p>
 */
public class SecondaryContactPolicy {

    public Optional<NewContact> secondaryFor(ResolvedCluster cluster, IdentifyRequest request) {
        if (!request.hasBoth()) {
            return Optional.empty();
        }
        boolean newEmail = request.email().filter(e -> !cluster.hasEmail(e)).isPresent();
        boolean newPhone = request.phoneNumber().filter(p -> !cluster.hasPhoneNumber(p)).isPresent();
        if (!newEmail && !newPhone) {
            return Optional.empty();
        }
        return Optional.of(NewContact.secondary(request.email(), request.phoneNumber(), cluster.primary().getId()));
    }
}
