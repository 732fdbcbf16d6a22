package com.contact.identity.api;

import com.contact.identity.core.model.Contact;
import com.contact.identity.core.model.LinkPrecedence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContactResponseBuilderTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final ContactResponseBuilder builder = new ContactResponseBuilder();

    private static Contact secondary(long id, String email, String phone, long primaryId, int minute) {
        return Contact.builder().id(id).email(email).phoneNumber(phone).linkedId(primaryId)
                .linkPrecedence(LinkPrecedence.SECONDARY).createdAt(T0.plusSeconds(60L * minute)).build();
    }

    @Test
    @DisplayName("Primary values lead, then distinct values in member order")
    void ordering() {
        Contact primary = Contact.builder().id(5).email("p@x.com").phoneNumber("555")
                .linkPrecedence(LinkPrecedence.PRIMARY).createdAt(T0).build();
        List<Contact> members = List.of(
                primary,
                secondary(3, "s@x.com", "555", 5, 1),
                secondary(9, "p@x.com", "999", 5, 2),
                secondary(7, null, "999", 5, 3));

        ContactSummary summary = builder.build(primary, members);

        assertEquals(5, summary.primaryContactId());
        assertEquals(List.of("p@x.com", "s@x.com"), summary.emails());
        assertEquals(List.of("555", "999"), summary.phoneNumbers());
        assertEquals(List.of(3L, 9L, 7L), summary.secondaryContactIds());
        assertEquals(4, summary.clusterSize());
    }

    @Test
    @DisplayName("A primary without an email does not lead the email list")
    void primaryMissingField() {
        Contact primary = Contact.builder().id(1).phoneNumber("111")
                .linkPrecedence(LinkPrecedence.PRIMARY).createdAt(T0).build();

        ContactSummary summary = builder.build(primary, List.of(primary, secondary(2, "b@x.com", "111", 1, 1)));

        assertEquals(List.of("b@x.com"), summary.emails());
        assertEquals(List.of("111"), summary.phoneNumbers());
    }

    @Test
    @DisplayName("A lone primary has no secondaries")
    void lonePrimary() {
        Contact primary = Contact.builder().id(1).email("a@x.com")
                .linkPrecedence(LinkPrecedence.PRIMARY).createdAt(T0).build();

        ContactSummary summary = builder.build(primary, List.of(primary));

        assertTrue(summary.secondaryContactIds().isEmpty());
        assertTrue(summary.phoneNumbers().isEmpty());
        assertEquals(1, summary.clusterSize());
    }
}
