package com.contact.identity.tracing;

/**
 * A unit of work in a trace. Closing the span ends it, so spans belong in
 * try-with-resources blocks.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("contact.identify")) {
 *     span.setAttribute("primaryContactId", 42L);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
