package com.contact.identity.store;

/**
 * Persistence engine for contacts. Abstracts the underlying storage so the
 * reconciliation core only sees {@link ContactTransaction}.
 */
public interface ContactStore extends AutoCloseable {

    /**
     * Runs the work in a single atomic transaction. If the work throws, every
     * mutation it made is rolled back and the exception is rethrown.
     *
     * @throws StoreException if the store fails or times out
     */
    <T> T inTransaction(TransactionWork<T> work);

    /**
     * Performs a trivial round trip to the store.
     *
     * @throws StoreException if the store cannot be reached
     */
    void ping();

    /**
     * Short name of the engine, used in logs and health details.
     */
    String getName();

    @Override
    default void close() {
    }
}
