package com.contact.identity.store;

import com.contact.identity.core.model.LinkPrecedence;

import java.util.Optional;

/**
 * Field changes applied by {@link ContactTransaction#updateContact} and
 * {@link ContactTransaction#updateContactsWhere}. The store bumps
 * {@code updatedAt} on every row it touches.
 *
 * @param linkPrecedence new precedence, or empty to leave it unchanged
 * @param linkedId       new primary the rows point at
 */
public record ContactUpdate(Optional<LinkPrecedence> linkPrecedence, long linkedId) {

    public ContactUpdate {
        linkPrecedence = linkPrecedence != null ? linkPrecedence : Optional.empty();
        if (linkPrecedence.filter(p -> p == LinkPrecedence.PRIMARY).isPresent()) {
            throw new IllegalArgumentException("An update cannot promote a contact to primary");
        }
    }

    /**
     * Turns a primary into a secondary of {@code primaryId}.
     */
    public static ContactUpdate demoteTo(long primaryId) {
        return new ContactUpdate(Optional.of(LinkPrecedence.SECONDARY), primaryId);
    }

    /**
     * Points secondaries at {@code primaryId}, leaving their precedence alone.
     */
    public static ContactUpdate relinkTo(long primaryId) {
        return new ContactUpdate(Optional.empty(), primaryId);
    }
}
