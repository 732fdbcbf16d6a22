package com.contact.identity.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Thread-safe in-memory {@link AuditRepository}. This is the default.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    @Override
    public List<AuditEntry> findByContactId(long contactId) {
        return filter(e -> e.contactId() == contactId);
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return filter(e -> e.action() == action);
    }

    @Override
    public List<AuditEntry> findBetween(Instant start, Instant end) {
        return filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end));
    }

    @Override
    public int count() {
        return entries.size();
    }

    private List<AuditEntry> filter(Predicate<AuditEntry> predicate) {
        return entries.stream().filter(predicate).toList();
    }
}
