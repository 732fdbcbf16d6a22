package com.contact.identity.store;

/**
 * Work executed inside a store transaction.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(ContactTransaction tx);
}
