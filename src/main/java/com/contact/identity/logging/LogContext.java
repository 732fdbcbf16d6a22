package com.contact.identity.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries. Closing a context restores every key it touched to
 * the value it had before, so a merge context opened inside an identify
 * context hands {@code operation} back to {@code identify} when it ends.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forIdentify(correlationId)) {
 *     log.info("identify.completed primaryContactId={}", primaryId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Deque<String[]> saved = new ArrayDeque<>();

    private LogContext() {
    }

    public static LogContext forIdentify(String correlationId) {
        return new LogContext()
                .with("correlationId", correlationId)
                .with("operation", "identify");
    }

    public static LogContext forLookup(String correlationId, long contactId) {
        return new LogContext()
                .with("correlationId", correlationId)
                .with("contactId", String.valueOf(contactId))
                .with("operation", "lookup");
    }

    /**
     * Context for folding a stale primary's cluster into the true primary's.
     * Keeps the enclosing correlation id.
     */
    public static LogContext forMerge(long stalePrimaryId, long truePrimaryId) {
        return new LogContext()
                .with("stalePrimaryId", String.valueOf(stalePrimaryId))
                .with("truePrimaryId", String.valueOf(truePrimaryId))
                .with("operation", "merge");
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        saved.push(new String[]{key, MDC.get(key)});
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        while (!saved.isEmpty()) {
            String[] entry = saved.pop();
            if (entry[1] == null) {
                MDC.remove(entry[0]);
            } else {
                MDC.put(entry[0], entry[1]);
            }
        }
    }
}
