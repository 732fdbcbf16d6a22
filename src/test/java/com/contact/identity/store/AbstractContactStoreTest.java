package com.contact.identity.store;

import com.contact.identity.core.model.Contact;
import com.contact.identity.core.model.LinkPrecedence;
import com.contact.identity.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior every {@link ContactStore} engine must share.
 */
abstract class AbstractContactStoreTest {

    protected MutableClock clock;
    protected ContactStore store;

    protected abstract ContactStore createStore(MutableClock clock);

    protected abstract void tombstone(ContactStore store, long id);

    @BeforeEach
    void setUpStore() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        store = createStore(clock);
    }

    @AfterEach
    void closeStore() {
        store.close();
    }

    protected Contact create(NewContact contact) {
        Contact created = store.inTransaction(tx -> tx.createContact(contact));
        clock.advance(Duration.ofSeconds(1));
        return created;
    }

    protected List<Contact> find(ContactCriteria criteria) {
        return store.inTransaction(tx -> tx.findContacts(criteria));
    }

    protected Contact get(long id) {
        List<Contact> found = find(ContactCriteria.anyOf().ids(List.of(id)).build());
        assertEquals(1, found.size(), "expected contact " + id);
        return found.get(0);
    }

    @Test
    @DisplayName("Create assigns id and timestamps")
    void createAssignsIdAndTimestamps() {
        Contact created = create(NewContact.primary(Optional.of("a@x.com"), Optional.of("111")));

        assertTrue(created.getId() > 0);
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), created.getCreatedAt());
        assertEquals(created.getCreatedAt(), created.getUpdatedAt());
        assertTrue(created.isPrimary());
        assertTrue(created.getLinkedId().isEmpty());

        Contact reread = get(created.getId());
        assertEquals(Optional.of("a@x.com"), reread.getEmail());
        assertEquals(Optional.of("111"), reread.getPhoneNumber());
        assertEquals(created.getCreatedAt(), reread.getCreatedAt());
    }

    @Test
    @DisplayName("Find ORs email and phone and orders by createdAt")
    void findOrdersByCreatedAt() {
        Contact first = create(NewContact.primary(Optional.of("a@x.com"), Optional.empty()));
        Contact second = create(NewContact.primary(Optional.empty(), Optional.of("111")));
        create(NewContact.primary(Optional.of("other@x.com"), Optional.of("999")));

        List<Contact> found = find(ContactCriteria.anyOf()
                .email(Optional.of("a@x.com"))
                .phoneNumber(Optional.of("111"))
                .build());

        assertEquals(List.of(first.getId(), second.getId()), found.stream().map(Contact::getId).toList());
    }

    @Test
    @DisplayName("Identical createdAt falls back to id order")
    void sameTimestampOrderedById() {
        Contact a = store.inTransaction(tx -> tx.createContact(NewContact.primary(Optional.of("a@x.com"), Optional.empty())));
        Contact b = store.inTransaction(tx -> tx.createContact(NewContact.primary(Optional.of("a@x.com"), Optional.empty())));

        List<Contact> found = find(ContactCriteria.anyOf().email(Optional.of("a@x.com")).build());

        assertEquals(a.getCreatedAt(), b.getCreatedAt());
        assertEquals(List.of(a.getId(), b.getId()), found.stream().map(Contact::getId).toList());
    }

    @Test
    @DisplayName("Tombstoned contacts are invisible to reads and updates")
    void tombstoneFilter() {
        Contact primary = create(NewContact.primary(Optional.of("a@x.com"), Optional.empty()));
        Contact secondary = create(NewContact.secondary(Optional.of("b@x.com"), Optional.empty(), primary.getId()));
        tombstone(store, secondary.getId());

        assertTrue(find(ContactCriteria.anyOf().email(Optional.of("b@x.com")).build()).isEmpty());
        int updated = store.inTransaction(tx ->
                tx.updateContactsWhere(ContactCriteria.linkedTo(primary.getId()), ContactUpdate.relinkTo(primary.getId())));
        assertEquals(0, updated);
        assertTrue(store.inTransaction(tx -> tx.lockContacts(List.of(secondary.getId()))).isEmpty());
    }

    @Test
    @DisplayName("Demotion changes precedence and link, and bumps updatedAt")
    void demote() {
        Contact older = create(NewContact.primary(Optional.of("a@x.com"), Optional.empty()));
        Contact newer = create(NewContact.primary(Optional.of("b@x.com"), Optional.empty()));

        store.inTransaction(tx -> {
            tx.updateContact(newer.getId(), ContactUpdate.demoteTo(older.getId()));
            return null;
        });

        Contact demoted = get(newer.getId());
        assertTrue(demoted.isSecondary());
        assertEquals(Optional.of(older.getId()), demoted.getLinkedId());
        assertTrue(demoted.getUpdatedAt().isAfter(newer.getUpdatedAt()));
        assertEquals(newer.getCreatedAt(), demoted.getCreatedAt());
    }

    @Test
    @DisplayName("Bulk re-link moves every secondary and leaves precedence alone")
    void bulkRelink() {
        Contact target = create(NewContact.primary(Optional.of("a@x.com"), Optional.empty()));
        Contact stale = create(NewContact.primary(Optional.of("b@x.com"), Optional.empty()));
        Contact s1 = create(NewContact.secondary(Optional.of("c@x.com"), Optional.empty(), stale.getId()));
        Contact s2 = create(NewContact.secondary(Optional.empty(), Optional.of("222"), stale.getId()));

        int relinked = store.inTransaction(tx ->
                tx.updateContactsWhere(ContactCriteria.linkedTo(stale.getId()), ContactUpdate.relinkTo(target.getId())));

        assertEquals(2, relinked);
        for (long id : List.of(s1.getId(), s2.getId())) {
            Contact moved = get(id);
            assertEquals(LinkPrecedence.SECONDARY, moved.getLinkPrecedence());
            assertEquals(Optional.of(target.getId()), moved.getLinkedId());
        }
        assertTrue(get(stale.getId()).isPrimary());
    }

    @Test
    @DisplayName("Updating a missing contact fails")
    void updateMissing() {
        assertThrows(StoreException.class, () -> store.inTransaction(tx -> {
            tx.updateContact(4242, ContactUpdate.relinkTo(1));
            return null;
        }));
    }

    @Test
    @DisplayName("A failing unit rolls back every mutation it made")
    void rollbackOnFailure() {
        Contact older = create(NewContact.primary(Optional.of("a@x.com"), Optional.empty()));
        Contact newer = create(NewContact.primary(Optional.of("b@x.com"), Optional.empty()));

        assertThrows(IllegalStateException.class, () -> store.inTransaction(tx -> {
            tx.updateContact(newer.getId(), ContactUpdate.demoteTo(older.getId()));
            tx.createContact(NewContact.secondary(Optional.of("c@x.com"), Optional.empty(), older.getId()));
            throw new IllegalStateException("abort");
        }));

        assertTrue(get(newer.getId()).isPrimary());
        assertTrue(find(ContactCriteria.anyOf().email(Optional.of("c@x.com")).build()).isEmpty());
    }

    @Test
    @DisplayName("Lock returns live rows in id order")
    void lockOrder() {
        Contact a = create(NewContact.primary(Optional.of("a@x.com"), Optional.empty()));
        Contact b = create(NewContact.primary(Optional.of("b@x.com"), Optional.empty()));

        List<Contact> locked = store.inTransaction(tx -> tx.lockContacts(List.of(b.getId(), a.getId(), 9999L)));

        assertEquals(List.of(a.getId(), b.getId()), locked.stream().map(Contact::getId).toList());
    }

    @Test
    @DisplayName("Empty criteria read nothing")
    void emptyCriteria() {
        create(NewContact.primary(Optional.of("a@x.com"), Optional.empty()));
        assertTrue(find(ContactCriteria.anyOf().build()).isEmpty());
    }

    @Test
    @DisplayName("Ping succeeds on a healthy store")
    void ping() {
        assertDoesNotThrow(store::ping);
    }
}
