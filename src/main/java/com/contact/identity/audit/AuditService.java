package com.contact.identity.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Records and queries the audit trail of committed contact mutations.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("Audit entry recorded: {} for contact {} by {}",
                entry.action(), entry.contactId(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, long contactId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .contactId(contactId)
                .actorId(actorId)
                .details(details)
                .build());
    }

    public AuditEntry record(AuditAction action, long contactId, String actorId) {
        return record(action, contactId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForContact(long contactId) {
        return repository.findByContactId(contactId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public int size() {
        return repository.count();
    }
}
