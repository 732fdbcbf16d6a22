package com.contact.identity.store;

import com.contact.identity.core.model.LinkPrecedence;

import java.util.Objects;
import java.util.Optional;

/**
 * Fields of a contact about to be created. The store assigns id and timestamps.
 */
public record NewContact(
        Optional<String> email,
        Optional<String> phoneNumber,
        Optional<Long> linkedId,
        LinkPrecedence linkPrecedence
) {
    public NewContact {
        Objects.requireNonNull(email, "email is required");
        Objects.requireNonNull(phoneNumber, "phoneNumber is required");
        Objects.requireNonNull(linkedId, "linkedId is required");
        Objects.requireNonNull(linkPrecedence, "linkPrecedence is required");
        if ((linkPrecedence == LinkPrecedence.SECONDARY) != linkedId.isPresent()) {
            throw new IllegalArgumentException("linkedId must be set exactly for secondary contacts");
        }
    }

    public static NewContact primary(Optional<String> email, Optional<String> phoneNumber) {
        return new NewContact(email, phoneNumber, Optional.empty(), LinkPrecedence.PRIMARY);
    }

    public static NewContact secondary(Optional<String> email, Optional<String> phoneNumber, long primaryId) {
        return new NewContact(email, phoneNumber, Optional.of(primaryId), LinkPrecedence.SECONDARY);
    }
}
