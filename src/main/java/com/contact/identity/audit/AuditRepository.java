package com.contact.identity.audit;

import java.time.Instant;
import java.util.List;

/**
 * Storage for audit entries. Entries are append-only.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByContactId(long contactId);

    List<AuditEntry> findByAction(AuditAction action);

    /**
     * Entries whose timestamp lies in {@code [start, end]}.
     */
    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();
}
