package com.contact.identity.tracing;

import java.util.Map;

/**
 * Default {@link TracingService} when no tracer is configured. Spans record nothing.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName) {
        return InertSpan.INSTANCE;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return InertSpan.INSTANCE;
    }

    private enum InertSpan implements Span {
        INSTANCE;

        @Override
        public void setAttribute(String key, String value) {
            // nothing to record
        }

        @Override
        public void setAttribute(String key, long value) {
            // nothing to record
        }

        @Override
        public void setStatus(SpanStatus status) {
            // nothing to record
        }

        @Override
        public void recordException(Throwable t) {
            // nothing to record
        }

        @Override
        public void close() {
            // nothing to end
        }
    }
}
