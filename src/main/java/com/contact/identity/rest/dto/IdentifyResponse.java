package com.contact.identity.rest.dto;

import com.contact.identity.api.ContactSummary;

import java.util.List;

/**
 * {@code { "contact": { primaryContactId, emails, phoneNumbers, secondaryContactIds } }}
 */
public record IdentifyResponse(ContactBody contact) {

    public static IdentifyResponse from(ContactSummary summary) {
        return new IdentifyResponse(new ContactBody(
                summary.primaryContactId(),
                summary.emails(),
                summary.phoneNumbers(),
                summary.secondaryContactIds()));
    }

    public record ContactBody(
            long primaryContactId,
            List<String> emails,
            List<String> phoneNumbers,
            List<Long> secondaryContactIds
    ) {
    }
}
