package com.contact.identity.metrics;

import com.contact.identity.core.model.IdentifyOutcome;
import com.contact.identity.core.model.LinkPrecedence;

import java.time.Duration;

/**
 * Records contact reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the service runs
 * without a metrics backend.
 */
public interface MetricsService {

    void recordIdentifyDuration(IdentifyOutcome outcome, Duration duration);

    void incrementContactCreated(LinkPrecedence precedence);

    void incrementPrimaryDemoted(int count);

    void recordClusterSize(int size);

    void incrementIdentifyFailed(String errorType);

    void incrementIdentifyRetried();
}
