package com.contact.identity.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} backed by the OpenTelemetry API. Spans are internal
 * spans of the caller's trace; every attribute key is namespaced under
 * {@value #ATTRIBUTE_PREFIX} so contact attributes never collide with the
 * semantic-convention keys set by the HTTP layer.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String ATTRIBUTE_PREFIX = "contact.";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach((key, value) -> builder.setAttribute(ATTRIBUTE_PREFIX + key, value));
        }
        return new ContactSpan(builder.startSpan());
    }

    private static final class ContactSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;
        private String errorType;

        ContactSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            if (status == SpanStatus.OK) {
                delegate.setStatus(StatusCode.OK);
            } else {
                delegate.setStatus(StatusCode.ERROR, errorType != null ? errorType : "");
            }
        }

        @Override
        public void recordException(Throwable t) {
            errorType = t.getClass().getSimpleName();
            delegate.setAttribute("error.type", t.getClass().getName());
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
