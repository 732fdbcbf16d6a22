package com.contact.identity.match;

import com.contact.identity.api.InvalidRequestException;
import com.contact.identity.core.model.Contact;
import com.contact.identity.store.ContactCriteria;
import com.contact.identity.store.ContactTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finds the contacts sharing an exact email or phone number with a request.
 * Matching is literal: no normalization, no fuzzy comparison.
 */
public class ContactMatcher {
    private static final Logger log = LoggerFactory.getLogger(ContactMatcher.class);

    /**
     * Returns every non-deleted contact whose email equals {@code email} or whose
     * phone number equals {@code phoneNumber}. An absent identifier contributes no
     * predicate; it never matches rows where that field is null.
     *
     * @return matches ordered by createdAt ascending, then id ascending
     * @throws InvalidRequestException if both identifiers are absent
     */
    public List<Contact> findMatches(ContactTransaction tx, Optional<String> email, Optional<String> phoneNumber) {
        if (email.isEmpty() && phoneNumber.isEmpty()) {
            throw new InvalidRequestException("At least one of email or phoneNumber is required");
        }
        List<Contact> matches = tx.findContacts(ContactCriteria.anyOf()
                .email(email)
                .phoneNumber(phoneNumber)
                .build());
        log.debug("match.found count={} byEmail={} byPhone={}",
                matches.size(), email.isPresent(), phoneNumber.isPresent());
        return matches;
    }
}
