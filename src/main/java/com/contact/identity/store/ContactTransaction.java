package com.contact.identity.store;

import com.contact.identity.core.model.Contact;

import java.util.Collection;
import java.util.List;

/**
 * Operations available inside one atomic unit of work opened by
 * {@link ContactStore#inTransaction}. Every read applies the tombstone filter.
 */
public interface ContactTransaction {

    /**
     * Finds the non-deleted contacts matching any predicate of the criteria.
     *
     * @return matches ordered by {@code createdAt} ascending, then id ascending
     */
    List<Contact> findContacts(ContactCriteria criteria);

    /**
     * Takes an exclusive row lock on the non-deleted contacts with the given ids,
     * held until the transaction ends. Rows are locked in ascending id order.
     *
     * @return the locked contacts, ordered by id
     */
    List<Contact> lockContacts(Collection<Long> ids);

    /**
     * Creates a contact and returns it with its assigned id and timestamps.
     */
    Contact createContact(NewContact contact);

    /**
     * Applies an update to a single non-deleted contact.
     *
     * @throws StoreException if no such contact exists
     */
    void updateContact(long id, ContactUpdate update);

    /**
     * Applies an update to every non-deleted contact matching the criteria.
     *
     * @return number of contacts updated
     */
    int updateContactsWhere(ContactCriteria criteria, ContactUpdate update);
}
