package com.contact.identity.store;

import com.contact.identity.core.model.Contact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process implementation of {@link ContactStore}.
 * Transactions are serialized by a single store-wide lock and rolled back
 * through a {@link CompensatingTransaction}. Suitable for tests and single-JVM
 * embedding; state is lost when the JVM exits.
 */
public class InMemoryContactStore implements ContactStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryContactStore.class);

    private final Map<Long, Contact> rows = new LinkedHashMap<>();
    private final ReentrantLock storeLock = new ReentrantLock(true);
    private final Clock clock;
    private final Duration lockTimeout;
    private long nextId = 1;

    public InMemoryContactStore() {
        this(Clock.systemUTC(), Duration.ofSeconds(5));
    }

    public InMemoryContactStore(Clock clock) {
        this(clock, Duration.ofSeconds(5));
    }

    public InMemoryContactStore(Clock clock, Duration lockTimeout) {
        this.clock = clock;
        this.lockTimeout = lockTimeout;
    }

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        acquire();
        try (CompensatingTransaction undo = new CompensatingTransaction()) {
            InMemoryTransaction tx = new InMemoryTransaction(undo);
            T result = work.execute(tx);
            tx.ensureActive();
            undo.commit();
            return result;
        } finally {
            storeLock.unlock();
        }
    }

    @Override
    public void ping() {
        acquire();
        storeLock.unlock();
    }

    @Override
    public String getName() {
        return "in-memory";
    }

    /**
     * Soft-deletes a contact. Tombstoning is managed outside the reconciliation
     * core; this hook exists for administration and test fixtures.
     */
    public void tombstone(long id) {
        acquire();
        try {
            Contact row = rows.get(id);
            if (row == null) {
                throw new StoreException("Contact not found: " + id);
            }
            Instant now = clock.instant();
            rows.put(id, Contact.builder(row).deletedAt(now).updatedAt(now).build());
        } finally {
            storeLock.unlock();
        }
    }

    /**
     * Snapshot of every stored row, tombstoned ones included, in id order.
     */
    public List<Contact> findAll() {
        acquire();
        try {
            List<Contact> all = new ArrayList<>(rows.values());
            all.sort(Comparator.comparingLong(Contact::getId));
            return all;
        } finally {
            storeLock.unlock();
        }
    }

    public int size() {
        return findAll().size();
    }

    private void acquire() {
        try {
            if (!storeLock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new StoreTimeoutException(
                        "Could not acquire in-memory store lock within " + lockTimeout.toMillis() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting for the in-memory store", e);
        }
    }

    private class InMemoryTransaction implements ContactTransaction {

        private final CompensatingTransaction undo;

        InMemoryTransaction(CompensatingTransaction undo) {
            this.undo = undo;
        }

        @Override
        public List<Contact> findContacts(ContactCriteria criteria) {
            ensureActive();
            if (criteria.isEmpty()) {
                return List.of();
            }
            return rows.values().stream()
                    .filter(criteria::matches)
                    .sorted(Contact.SENIORITY)
                    .toList();
        }

        @Override
        public List<Contact> lockContacts(Collection<Long> ids) {
            ensureActive();
            // the store-wide lock already covers every row
            return ids.stream()
                    .distinct()
                    .sorted()
                    .map(rows::get)
                    .filter(c -> c != null && !c.isDeleted())
                    .toList();
        }

        @Override
        public Contact createContact(NewContact contact) {
            ensureActive();
            return undo.execute("create contact", () -> {
                Instant now = clock.instant();
                Contact created = Contact.builder()
                        .id(nextId++)
                        .email(contact.email().orElse(null))
                        .phoneNumber(contact.phoneNumber().orElse(null))
                        .linkedId(contact.linkedId().orElse(null))
                        .linkPrecedence(contact.linkPrecedence())
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
                rows.put(created.getId(), created);
                log.trace("Created contact {}", created);
                return created;
            }, created -> rows.remove(created.getId()));
        }

        @Override
        public void updateContact(long id, ContactUpdate update) {
            ensureActive();
            Contact current = rows.get(id);
            if (current == null || current.isDeleted()) {
                throw new StoreException("Contact not found: " + id);
            }
            replace(current, update);
        }

        @Override
        public int updateContactsWhere(ContactCriteria criteria, ContactUpdate update) {
            ensureActive();
            List<Contact> targets = findContacts(criteria);
            for (Contact current : targets) {
                replace(current, update);
            }
            return targets.size();
        }

        private void replace(Contact current, ContactUpdate update) {
            Contact.Builder changed = Contact.builder(current)
                    .linkedId(update.linkedId())
                    .updatedAt(clock.instant());
            update.linkPrecedence().ifPresent(changed::linkPrecedence);
            Contact updated = changed.build();
            undo.execute("update contact " + current.getId(),
                    () -> rows.put(updated.getId(), updated),
                    () -> rows.put(current.getId(), current));
        }

        void ensureActive() {
            if (Thread.currentThread().isInterrupted()) {
                throw new StoreUnavailableException("Transaction cancelled: calling thread was interrupted");
            }
        }
    }
}
