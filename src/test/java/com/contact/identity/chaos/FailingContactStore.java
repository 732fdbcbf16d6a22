package com.contact.identity.chaos;

import com.contact.identity.core.model.Contact;
import com.contact.identity.store.ContactCriteria;
import com.contact.identity.store.ContactStore;
import com.contact.identity.store.ContactTransaction;
import com.contact.identity.store.ContactUpdate;
import com.contact.identity.store.NewContact;
import com.contact.identity.store.StoreTimeoutException;
import com.contact.identity.store.StoreUnavailableException;
import com.contact.identity.store.TransactionWork;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator around a {@link ContactStore} that injects failures into
 * transactions for resilience testing.
 */
public class FailingContactStore implements ContactStore {

    private final ContactStore delegate;
    private final AtomicInteger timeoutsBeforeSuccess = new AtomicInteger(0);
    private final AtomicBoolean failOnRelink = new AtomicBoolean(false);
    private final AtomicBoolean failOnCreate = new AtomicBoolean(false);
    private final AtomicBoolean failOnPing = new AtomicBoolean(false);
    private final AtomicInteger transactionCount = new AtomicInteger(0);

    public FailingContactStore(ContactStore delegate) {
        this.delegate = delegate;
    }

    /**
     * The next {@code n} transactions time out on their first read.
     */
    public void timeOutNextTransactions(int n) {
        timeoutsBeforeSuccess.set(n);
    }

    /**
     * Bulk re-link updates fail after the demotion they follow has been applied.
     */
    public void setFailOnRelink(boolean fail) {
        failOnRelink.set(fail);
    }

    public void setFailOnCreate(boolean fail) {
        failOnCreate.set(fail);
    }

    public void setFailOnPing(boolean fail) {
        failOnPing.set(fail);
    }

    public int getTransactionCount() {
        return transactionCount.get();
    }

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        transactionCount.incrementAndGet();
        boolean timeOut = timeoutsBeforeSuccess.getAndUpdate(n -> Math.max(0, n - 1)) > 0;
        return delegate.inTransaction(tx -> work.execute(new FailingTransaction(tx, timeOut)));
    }

    @Override
    public void ping() {
        if (failOnPing.get()) {
            throw new StoreUnavailableException("Chaos: store unreachable");
        }
        delegate.ping();
    }

    @Override
    public String getName() {
        return "chaos-" + delegate.getName();
    }

    private class FailingTransaction implements ContactTransaction {

        private final ContactTransaction tx;
        private boolean timeOut;

        FailingTransaction(ContactTransaction tx, boolean timeOut) {
            this.tx = tx;
            this.timeOut = timeOut;
        }

        @Override
        public List<Contact> findContacts(ContactCriteria criteria) {
            if (timeOut) {
                timeOut = false;
                throw new StoreTimeoutException("Chaos: query timed out");
            }
            return tx.findContacts(criteria);
        }

        @Override
        public List<Contact> lockContacts(Collection<Long> ids) {
            return tx.lockContacts(ids);
        }

        @Override
        public Contact createContact(NewContact contact) {
            if (failOnCreate.get()) {
                throw new StoreUnavailableException("Chaos: insert failed");
            }
            return tx.createContact(contact);
        }

        @Override
        public void updateContact(long id, ContactUpdate update) {
            tx.updateContact(id, update);
        }

        @Override
        public int updateContactsWhere(ContactCriteria criteria, ContactUpdate update) {
            if (failOnRelink.get()) {
                throw new StoreUnavailableException("Chaos: bulk update failed");
            }
            return tx.updateContactsWhere(criteria, update);
        }
    }
}
