package com.contact.identity.tracing;

import java.util.Map;

/**
 * Starts trace spans around reconciliations.
 * The default {@link NoOpTracingService} does nothing.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
