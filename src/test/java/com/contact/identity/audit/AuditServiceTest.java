package com.contact.identity.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private InMemoryAuditRepository repository;
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuditRepository();
        auditService = new AuditService(repository);
    }

    @Test
    @DisplayName("Recorded entries carry action, contact and actor")
    void record() {
        AuditEntry entry = auditService.record(AuditAction.PRIMARY_DEMOTED, 7, "IDENTIFY_API",
                Map.of("truePrimaryId", 3L));

        assertNotNull(entry.id());
        assertNotNull(entry.timestamp());
        assertEquals(AuditAction.PRIMARY_DEMOTED, entry.action());
        assertEquals(7, entry.contactId());
        assertEquals(3L, entry.details().get("truePrimaryId"));
        assertEquals(1, repository.count());
    }

    @Test
    @DisplayName("Entries can be queried by contact and by action")
    void queries() {
        auditService.record(AuditAction.CONTACT_CREATED, 1, "IDENTIFY_API");
        auditService.record(AuditAction.CONTACT_CREATED, 2, "IDENTIFY_API");
        auditService.record(AuditAction.PRIMARY_DEMOTED, 2, "IDENTIFY_API");

        assertEquals(2, auditService.getEntriesForContact(2).size());
        assertEquals(2, auditService.getEntriesByAction(AuditAction.CONTACT_CREATED).size());
        assertTrue(auditService.getEntriesByAction(AuditAction.CONTACTS_RELINKED).isEmpty());
        assertEquals(3, auditService.size());
        assertEquals(3, auditService.getAllEntries().size());
    }

    @Test
    @DisplayName("Time range queries are inclusive")
    void between() {
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        repository.save(AuditEntry.builder().action(AuditAction.CONTACT_CREATED).contactId(1)
                .actorId("test").timestamp(t0).build());
        repository.save(AuditEntry.builder().action(AuditAction.CONTACT_CREATED).contactId(2)
                .actorId("test").timestamp(t0.plusSeconds(60)).build());
        repository.save(AuditEntry.builder().action(AuditAction.CONTACT_CREATED).contactId(3)
                .actorId("test").timestamp(t0.plusSeconds(120)).build());

        List<AuditEntry> found = repository.findBetween(t0, t0.plusSeconds(60));

        assertEquals(List.of(1L, 2L), found.stream().map(AuditEntry::contactId).toList());
    }

    @Test
    @DisplayName("Details are copied defensively")
    void immutableDetails() {
        AuditEntry entry = auditService.record(AuditAction.CONTACT_CREATED, 1, "IDENTIFY_API", Map.of("k", "v"));

        assertThrows(UnsupportedOperationException.class, () -> entry.details().put("x", "y"));
    }
}
