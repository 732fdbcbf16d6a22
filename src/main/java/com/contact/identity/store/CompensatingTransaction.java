package com.contact.identity.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Undo log for stores without native transactions.
 * Each applied mutation registers a compensation; if the transaction is closed
 * without {@link #commit()}, compensations run in reverse order.
 *
 * <pre>
 * try (CompensatingTransaction tx = new CompensatingTransaction()) {
 *     Contact c = tx.execute("create contact", () -> insert(...), created -> remove(created));
 *     tx.execute("demote contact", () -> replace(newRow), () -> replace(oldRow));
 *     tx.commit();
 * }
 * </pre>
 */
public class CompensatingTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CompensatingTransaction.class);

    private final Deque<Compensation> compensations = new ArrayDeque<>();
    private boolean committed = false;
    private boolean closed = false;

    /**
     * Applies a mutation and registers how to undo it.
     * If the mutation itself fails, earlier compensations run and the exception is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        execute(description, () -> {
            operation.run();
            return null;
        }, ignored -> compensation.run());
    }

    /**
     * Applies a mutation producing a value; the compensation receives that value.
     */
    public <T> T execute(String description, Supplier<T> operation, Consumer<T> compensation) {
        ensureOpen();
        try {
            log.trace("store.step {}", description);
            T result = operation.get();
            compensations.push(new Compensation(description, () -> compensation.accept(result)));
            return result;
        } catch (RuntimeException e) {
            log.warn("Store step '{}' failed: {}. Rolling back.", description, e.getMessage());
            rollback();
            throw e;
        }
    }

    /**
     * Discards the undo log; applied mutations become permanent.
     */
    public void commit() {
        ensureOpen();
        compensations.clear();
        committed = true;
    }

    public boolean isCommitted() {
        return committed;
    }

    /**
     * Number of mutations that would be undone by a rollback.
     */
    public int pendingCompensations() {
        return compensations.size();
    }

    @Override
    public void close() {
        if (!closed && !committed && !compensations.isEmpty()) {
            log.debug("Transaction closed without commit - undoing {} step(s)", compensations.size());
            rollback();
        }
        closed = true;
    }

    private void rollback() {
        while (!compensations.isEmpty()) {
            Compensation step = compensations.pop();
            try {
                step.undo().run();
            } catch (RuntimeException e) {
                log.error("Compensation for '{}' failed: {}", step.description(), e.getMessage(), e);
            }
        }
    }

    private void ensureOpen() {
        if (closed || committed) {
            throw new IllegalStateException("Transaction is already finished");
        }
    }

    private record Compensation(String description, Runnable undo) {}
}
